package shop.eda.catalog.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import shop.eda.catalog.consumer.ConsumerLoopManager;
import shop.eda.catalog.consumer.ConsumerState;
import shop.eda.catalog.model.Product;
import shop.eda.catalog.model.response.HealthCheck;
import shop.eda.catalog.model.response.PartitionStatus;
import shop.eda.catalog.service.HealthService;
import shop.eda.catalog.store.CatalogStore;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CatalogController.class)
class CatalogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CatalogStore catalogStore;

    @MockBean
    private ConsumerLoopManager consumerLoopManager;

    @MockBean
    private HealthService healthService;

    @Test
    void getCatalog_ShouldReturnAllProductsInOrder() throws Exception {
        when(catalogStore.snapshot()).thenReturn(List.of(
                new Product(1, "T-Shirt", 100),
                new Product(5, "Cap", 0)));

        mockMvc.perform(get("/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value(1))
                .andExpect(jsonPath("$[0].name").value("T-Shirt"))
                .andExpect(jsonPath("$[1].quantity").value(0));
    }

    @Test
    void getStock_KnownProduct_ShouldReturnQuantity() throws Exception {
        when(catalogStore.find(2)).thenReturn(Optional.of(new Product(2, "Jeans", 50)));

        mockMvc.perform(get("/catalog/stock/2"))
                .andExpect(status().isOk())
                .andExpect(content().string("50"));
    }

    @Test
    void getStock_UnknownProduct_ShouldReturnNotFound() throws Exception {
        when(catalogStore.find(99)).thenReturn(Optional.empty());

        mockMvc.perform(get("/catalog/stock/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"))
                .andExpect(jsonPath("$.message").value("Product not found: 99"))
                .andExpect(jsonPath("$.path").value("/catalog/stock/99"));
    }

    @Test
    void getStock_NonNumericId_ShouldReturnBadRequest() throws Exception {
        mockMvc.perform(get("/catalog/stock/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.itemId").value("must be an integer"));
    }

    @Test
    void consumerStatus_ShouldListPartitions() throws Exception {
        when(consumerLoopManager.isRunning()).thenReturn(true);
        when(consumerLoopManager.isConsuming()).thenReturn(true);
        when(consumerLoopManager.statuses()).thenReturn(List.of(
                new PartitionStatus("orders", 0, ConsumerState.IDLE, 12, 10, 1, 1, 0, 0, null)));

        mockMvc.perform(get("/catalog/consumer/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.consuming").value(true))
                .andExpect(jsonPath("$.partitions[0].committedOffset").value(12))
                .andExpect(jsonPath("$.partitions[0].state").value("IDLE"));
    }

    @Test
    void ready_KafkaDown_ShouldReturnServiceUnavailable() throws Exception {
        when(healthService.getServiceStatus()).thenReturn(new HealthCheck("UP", "ok"));
        when(healthService.getKafkaStatus()).thenReturn(new HealthCheck("DOWN", "unreachable"));
        when(healthService.getConsumerStatus()).thenReturn(new HealthCheck("DOWN", "waiting"));

        mockMvc.perform(get("/health/ready"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.checks.kafka.status").value("DOWN"));
    }

    @Test
    void ready_AllUp_ShouldReturnOk() throws Exception {
        when(healthService.getServiceStatus()).thenReturn(new HealthCheck("UP", "ok"));
        when(healthService.getKafkaStatus()).thenReturn(new HealthCheck("UP", "ok"));
        when(healthService.getConsumerStatus()).thenReturn(new HealthCheck("UP", "1 consumer loop(s) running"));

        mockMvc.perform(get("/health/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    void live_ShouldAlwaysBeUp() throws Exception {
        when(healthService.getServiceStatus()).thenReturn(new HealthCheck("UP", "ok"));

        mockMvc.perform(get("/health/live"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("liveness"));
    }
}
