package shop.eda.order.service.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import shop.eda.order.exception.CatalogUnavailableException;
import shop.eda.order.exception.InsufficientStockException;
import shop.eda.order.exception.OrderValidationException;

/**
 * RemoteItemCatalog
 * Asks the catalog service for the current stock of an item (GET /catalog/stock/{itemId}).
 * The answer is a snapshot: stock may change before the order event is applied.
 */
@Component
public class RemoteItemCatalog implements ItemCatalog {

    private static final Logger logger = LoggerFactory.getLogger(RemoteItemCatalog.class);

    private final RestClient catalogRestClient;

    public RemoteItemCatalog(RestClient catalogRestClient) {
        this.catalogRestClient = catalogRestClient;
    }

    @Override
    public void checkAvailability(int itemId, int quantity) {
        Integer stock;
        try {
            stock = catalogRestClient.get()
                    .uri("/catalog/stock/{itemId}", itemId)
                    .retrieve()
                    .body(Integer.class);
        } catch (HttpClientErrorException.NotFound e) {
            logger.warn("Item not found in catalog itemId={}", itemId);
            throw new OrderValidationException("item_id", "Unknown item_id: " + itemId);
        } catch (RestClientException e) {
            logger.error("Catalog stock lookup failed itemId={}: {}", itemId, e.getMessage());
            throw new CatalogUnavailableException("Catalog stock lookup failed for item " + itemId, e);
        }

        if (stock == null) {
            throw new CatalogUnavailableException("Catalog returned no stock for item " + itemId, null);
        }
        if (stock < quantity) {
            logger.warn("Insufficient stock itemId={} requested={} available={}", itemId, quantity, stock);
            throw new InsufficientStockException(itemId, quantity, stock);
        }
        logger.debug("Stock check passed itemId={} requested={} available={}", itemId, quantity, stock);
    }
}
