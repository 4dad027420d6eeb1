package com.phillippitts.multiroomaudio.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record OffsetRequest(
        @JsonProperty("delay_ms") @NotNull(message = "delay_ms is required") Integer delayMs) {
}
