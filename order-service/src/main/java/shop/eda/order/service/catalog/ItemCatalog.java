package shop.eda.order.service.catalog;

import shop.eda.order.exception.CatalogUnavailableException;
import shop.eda.order.exception.InsufficientStockException;
import shop.eda.order.exception.OrderValidationException;

/**
 * Read-only view of the catalog used to vet incoming orders.
 */
public interface ItemCatalog {

    /**
     * Checks that the item exists and has at least {@code quantity} units in stock.
     *
     * @throws OrderValidationException    if the item is unknown
     * @throws InsufficientStockException  if the stock is lower than requested
     * @throws CatalogUnavailableException if the catalog cannot be reached
     */
    void checkAvailability(int itemId, int quantity);
}
