package com.phillippitts.multiroomaudio.presentation.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Body of volume updates. The range is checked by the orchestrator so the failure reads the
 * same as any other operation result.
 */
public record VolumeRequest(@NotNull(message = "Volume is required") Integer volume) {
}
