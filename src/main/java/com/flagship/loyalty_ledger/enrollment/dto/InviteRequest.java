package com.flagship.loyalty_ledger.enrollment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class InviteRequest {

    @NotBlank(message = "Customer ID is required")
    @Size(max = 64)
    @JsonProperty("customer_id")
    String customerId;

    @NotBlank(message = "Program ID is required")
    @Size(max = 64)
    @JsonProperty("program_id")
    String programId;

    @NotBlank(message = "Business ID is required")
    @Size(max = 64)
    @JsonProperty("business_id")
    String businessId;
}
