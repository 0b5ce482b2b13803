package shop.eda.catalog.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Catalog seed data, consumer loop settings and the dedup window ({@code catalog.*}).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    @Valid
    private List<SeedProduct> products = new ArrayList<>();

    @Valid
    private Consumer consumer = new Consumer();

    @Valid
    private Dedup dedup = new Dedup();

    @Getter
    @Setter
    public static class SeedProduct {

        @NotNull
        private Integer id;

        @NotBlank
        private String name;

        @NotNull
        @Min(0)
        private Integer quantity;
    }

    @Getter
    @Setter
    public static class Consumer {

        private boolean autoStartup = true;

        private Duration pollTimeout = Duration.ofMillis(500);

        private Duration initialBackoff = Duration.ofMillis(500);

        private Duration maxBackoff = Duration.ofSeconds(10);

        private Duration shutdownTimeout = Duration.ofSeconds(10);

        private boolean deadLetterEnabled = true;
    }

    @Getter
    @Setter
    public static class Dedup {

        @Min(1)
        private int maxEntries = 100_000;

        @NotNull
        private Duration maxAge = Duration.ofDays(7);
    }
}
