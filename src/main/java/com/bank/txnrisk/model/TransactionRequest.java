package com.bank.txnrisk.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Incoming payload. Only {@code transaction_id} is required; absent fields are
 * filled with defaults during normalization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A payment transaction submitted for risk evaluation")
public class TransactionRequest {

    @JsonProperty("transaction_id")
    @Schema(description = "Caller-supplied transaction identifier, echoed back", example = "42",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private Long transactionId;

    @JsonProperty("amount_mxn")
    @Schema(description = "Amount in MXN. Defaults to 0", example = "5200.00")
    private BigDecimal amountMxn;

    @JsonProperty("customer_txn_30d")
    @Schema(description = "Customer transactions in the trailing 30 days. Defaults to 0", example = "1")
    private Integer customerTxn30d;

    @JsonProperty("geo_state")
    @Schema(description = "Billing / geographic state", example = "Nuevo León")
    private String geoState;

    @JsonProperty("device_type")
    @Schema(description = "Device type", example = "mobile")
    private String deviceType;

    @JsonProperty("chargeback_count")
    @Schema(description = "Historical chargebacks for this customer. Defaults to 0", example = "0")
    private Integer chargebackCount;

    @JsonProperty("hour")
    @Schema(description = "Local hour of the transaction (0-23)", example = "23")
    private Integer hour;

    @JsonProperty("product_type")
    @Schema(description = "Product type, selects the amount band", example = "digital")
    private String productType;

    @JsonProperty("latency_ms")
    @Schema(description = "Client-observed request latency. Defaults to 0", example = "180")
    private Long latencyMs;

    @JsonProperty("user_reputation")
    @Schema(description = "User reputation. Defaults to new", example = "new")
    private String userReputation;

    @JsonProperty("device_fingerprint_risk")
    @Schema(description = "Device fingerprint risk level. Defaults to low", example = "low")
    private String deviceFingerprintRisk;

    @JsonProperty("ip_risk")
    @Schema(description = "IP risk level. Defaults to low", example = "medium")
    private String ipRisk;

    @JsonProperty("email_risk")
    @Schema(description = "Email risk level. Defaults to low", example = "new_domain")
    private String emailRisk;

    @JsonProperty("bin_country")
    @Schema(description = "Card issuing country", example = "MX")
    private String binCountry;

    @JsonProperty("ip_country")
    @Schema(description = "Request origin country", example = "MX")
    private String ipCountry;
}
