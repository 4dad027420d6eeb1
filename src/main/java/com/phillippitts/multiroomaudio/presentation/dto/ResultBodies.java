package com.phillippitts.multiroomaudio.presentation.dto;

import com.phillippitts.multiroomaudio.domain.OperationResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON bodies for {@link OperationResult}: {@code {success, message}} on success,
 * {@code {success, error}} on failure, plus {@code warning} on partial success.
 */
public final class ResultBodies {

    private ResultBodies() {
    }

    public static Map<String, Object> of(OperationResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", result.success());
        body.put(result.success() ? "message" : "error", result.message());
        result.warningText().ifPresent(w -> body.put("warning", w));
        return body;
    }

    /** Variant that always reports the text under {@code message}. */
    public static Map<String, Object> withMessage(OperationResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", result.success());
        body.put("message", result.message());
        result.warningText().ifPresent(w -> body.put("warning", w));
        return body;
    }
}
