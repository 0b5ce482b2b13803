package shop.eda.catalog.exception;

import lombok.Getter;

@Getter
public class ProductNotFoundException extends RuntimeException {

    private final int productId;

    public ProductNotFoundException(int productId) {
        super("Product not found: " + productId);
        this.productId = productId;
    }
}
