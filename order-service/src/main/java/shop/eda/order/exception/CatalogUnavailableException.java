package shop.eda.order.exception;

/**
 * CatalogUnavailableException
 * Raised when the catalog service cannot be asked about an item.
 */
public class CatalogUnavailableException extends RuntimeException {

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
