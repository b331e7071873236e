package com.flagship.loyalty_ledger.scan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class ScanRequest {

    @NotBlank(message = "QR payload is required")
    @Size(max = 2048)
    @JsonProperty("qr_payload")
    String qrPayload;

    @NotBlank(message = "Business ID is required")
    @Size(max = 64)
    @JsonProperty("business_id")
    String businessId;

    @Size(max = 64)
    @JsonProperty("program_id")
    String programId;

    @NotNull(message = "Points are required")
    @Positive(message = "Points must be positive")
    @JsonProperty("points")
    Long points;

    @NotBlank(message = "Scan ID is required")
    @Size(max = 200)
    @JsonProperty("scan_id")
    String scanId;
}
