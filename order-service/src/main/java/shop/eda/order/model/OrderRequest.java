package shop.eda.order.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * OrderRequest - DTO for POST /order
 * Input: item_id, customer name, delivery address and a positive quantity.
 */
public record OrderRequest(

    @NotNull(message = "item_id is required")
    @JsonProperty("item_id")
    Integer itemId,

    @NotBlank(message = "name is required")
    @JsonProperty("name")
    String name,

    @NotBlank(message = "address is required")
    @JsonProperty("address")
    String address,

    @NotNull(message = "quantity is required")
    @Min(value = 1, message = "quantity must be at least 1")
    @JsonProperty("quantity")
    Integer quantity
) {}
