package com.flagship.loyalty_ledger.enrollment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class RespondRequest {

    @NotNull(message = "accept is required")
    @JsonProperty("accept")
    Boolean accept;
}
