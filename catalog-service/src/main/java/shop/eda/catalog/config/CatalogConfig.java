package shop.eda.catalog.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import shop.eda.catalog.model.Product;
import shop.eda.catalog.store.AppliedOrderWindow;
import shop.eda.catalog.store.CatalogStore;

import java.util.List;

@Configuration
public class CatalogConfig {

    @Bean
    public CatalogStore catalogStore(CatalogProperties properties) {
        List<Product> seed = properties.getProducts().stream()
                .map(p -> new Product(p.getId(), p.getName(), p.getQuantity()))
                .toList();
        AppliedOrderWindow window = new AppliedOrderWindow(
                properties.getDedup().getMaxEntries(), properties.getDedup().getMaxAge());
        return new CatalogStore(seed, window);
    }
}
