package com.bank.txnrisk.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI transactionRiskOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Transaction Risk API")
                        .version("1.0.0")
                        .description(
                                "Rule-based risk scoring for payment transactions.\n\n" +
                                "**Evaluation Pipeline:**\n" +
                                "1. Receive transaction via `POST /transaction`\n" +
                                "2. Fill defaults for missing fields and validate the rest\n" +
                                "3. Run every scoring rule; each triggered rule adds a signed delta and a reason\n" +
                                "4. Check hard blocks (e.g. repeat chargebacks from a high-risk IP)\n" +
                                "5. Decide: **REJECTED** (hard block or score >= reject-at), " +
                                "**IN_REVIEW** (score >= review-at), otherwise **ACCEPTED**\n\n" +
                                "**Rules:** `high_amount`, `new_user_high_amount`, `night_hour`, `geo_mismatch`, " +
                                "`latency_extreme`, `ip_risk`, `device_fingerprint_risk`, `email_risk`, " +
                                "`chargeback_history`, `frequency_buffer` (negative delta)\n\n" +
                                "Active thresholds and weights: `GET /config`.")
                        .contact(new Contact().name("Risk Engine Team")));
    }
}
