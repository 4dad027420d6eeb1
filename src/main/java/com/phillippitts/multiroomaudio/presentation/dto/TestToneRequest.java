package com.phillippitts.multiroomaudio.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record TestToneRequest(@NotBlank(message = "Device is required") String device) {
}
