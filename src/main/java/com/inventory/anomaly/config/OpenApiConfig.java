package com.inventory.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI inventoryAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Inventory Anomaly Detector API")
                        .version("1.0.0")
                        .description(
                                "Batch anomaly detection over inventory stock and consumption records.\n\n" +
                                "**Pipeline (one run):**\n" +
                                "1. `load_data` reads the inventory CSV and validates it\n" +
                                "2. `clean_data` → `create_features` → `train_forecast_models` (7-day forecast per product)\n" +
                                "3. `aggregate_data` → `detect_anomalies` (Isolation Forest, scores in [0, 1])\n" +
                                "4. `send_alerts` (Discord / Teams / email) and `generate_report`, both optional\n\n" +
                                "Required tasks retry 3 times in total; optional ones twice. An optional task can " +
                                "never fail the run.\n\n" +
                                "**Severity:** CRITICAL (>= 0.85), HIGH (>= 0.70), MEDIUM (>= min-alertable), NONE")
                        .contact(new Contact().name("Inventory Analytics Team")));
    }
}
