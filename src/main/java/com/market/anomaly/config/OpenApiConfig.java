package com.market.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI marketAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Market Anomaly Query API")
                        .version("1.0.0")
                        .description(
                                "Read API over crypto market prices and the statistical anomalies detected in them.\n\n" +
                                "**Price history:** `GET /prices/{symbol}` buckets samples by span when `aggregation=auto`:\n" +
                                "- up to 24h: raw 1-minute samples (`1m`)\n" +
                                "- up to 7d: 5-minute buckets aligned to the hour (`5m`)\n" +
                                "- up to 30d: hourly buckets (`1h`)\n" +
                                "- longer: daily buckets (`1d`)\n\n" +
                                "**Anomaly types:** `PRICE_SPIKE`, `PRICE_DROP`, `VOLUME_SPIKE`, `COMBINED`\n\n" +
                                "**Validation status** (derived from the linked narrative on every read):\n" +
                                "`NOT_GENERATED`, `PENDING`, `VALID`, `INVALID`\n\n" +
                                "**Thresholds:** asset override > volatility tier (stable x1.2, moderate x1.0, volatile x0.7) > global default")
                        .contact(new Contact().name("Market Anomaly Team")));
    }
}
