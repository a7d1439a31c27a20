package com.tracelens.model;

import java.util.Map;
import java.util.Set;

public enum SpanStatus {
    OK,
    ERROR;

    // Plain words plus the OpenTelemetry enum name and its numeric value
    private static final Set<String> ERROR_CODES = Set.of("error", "failed", "status_code_error", "2");

    /**
     * Resolves the status from the explicit status string, falling back to error markers in the attributes.
     */
    public static SpanStatus resolve(String status, Map<String, Object> attributes) {
        if (status != null && !status.isBlank()) {
            return isErrorCode(status) ? ERROR : OK;
        }
        if (attributes == null || attributes.isEmpty()) {
            return OK;
        }
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            String key = entry.getKey().toLowerCase();
            Object value = entry.getValue();
            if (value == null) continue;

            if (key.equals("http.status_code") || key.equals("http.response.status_code")) {
                try {
                    if (Integer.parseInt(value.toString().trim()) >= 400) {
                        return ERROR;
                    }
                } catch (NumberFormatException e) {
                    if (isErrorCode(value.toString())) {
                        return ERROR;
                    }
                }
            } else if (key.equals("otel.status_code") || key.equals("status.code")) {
                if (isErrorCode(value.toString())) {
                    return ERROR;
                }
            } else if (key.equals("success")) {
                if (value.toString().trim().equalsIgnoreCase("false")) {
                    return ERROR;
                }
            } else if ((key.contains("error") || key.contains("exception")) && isTruthy(value)) {
                return ERROR;
            }
        }
        return OK;
    }

    /**
     * True for the error words and codes above and for 5xx server codes.
     */
    static boolean isErrorCode(String code) {
        String s = code.trim().toLowerCase();
        return ERROR_CODES.contains(s) || s.matches("5\\d\\d");
    }

    private static boolean isTruthy(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String text = value.toString().trim();
        return !text.isEmpty() && !text.equalsIgnoreCase("false") && !text.equals("0");
    }
}
