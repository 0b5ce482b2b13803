package shop.eda.order.service.catalog;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import shop.eda.order.exception.CatalogUnavailableException;
import shop.eda.order.exception.InsufficientStockException;
import shop.eda.order.exception.OrderValidationException;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteItemCatalogTest {

    private MockRestServiceServer server;
    private RemoteItemCatalog catalog;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://catalog");
        server = MockRestServiceServer.bindTo(builder).build();
        catalog = new RemoteItemCatalog(builder.build());
    }

    @Test
    void checkAvailability_EnoughStock_ShouldPass() {
        server.expect(requestTo("http://catalog/catalog/stock/1"))
                .andRespond(withSuccess("10", MediaType.APPLICATION_JSON));

        assertDoesNotThrow(() -> catalog.checkAvailability(1, 10));
        server.verify();
    }

    @Test
    void checkAvailability_NotEnoughStock_ShouldThrowInsufficientStock() {
        server.expect(requestTo("http://catalog/catalog/stock/5"))
                .andRespond(withSuccess("1", MediaType.APPLICATION_JSON));

        InsufficientStockException ex = assertThrows(InsufficientStockException.class,
                () -> catalog.checkAvailability(5, 2));
        assertEquals(1, ex.getAvailable());
        assertEquals(2, ex.getRequested());
    }

    @Test
    void checkAvailability_UnknownItem_ShouldThrowValidation() {
        server.expect(requestTo("http://catalog/catalog/stock/99"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        OrderValidationException ex = assertThrows(OrderValidationException.class,
                () -> catalog.checkAvailability(99, 1));
        assertEquals("item_id", ex.getField());
    }

    @Test
    void checkAvailability_ServerError_ShouldThrowUnavailable() {
        server.expect(requestTo("http://catalog/catalog/stock/1"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThrows(CatalogUnavailableException.class, () -> catalog.checkAvailability(1, 1));
    }

    @Test
    void checkAvailability_ConnectionRefused_ShouldThrowUnavailable() {
        server.expect(requestTo("http://catalog/catalog/stock/1"))
                .andRespond(withException(new IOException("Connection refused")));

        assertThrows(CatalogUnavailableException.class, () -> catalog.checkAvailability(1, 1));
    }
}
