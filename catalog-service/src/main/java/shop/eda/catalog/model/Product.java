package shop.eda.catalog.model;

/**
 * Product - catalog entry. Identity and name never change; quantity only
 * changes when an order event is applied.
 */
public record Product(
    int id,
    String name,
    int quantity
) {

    public Product withQuantity(int newQuantity) {
        return new Product(id, name, newQuantity);
    }
}
