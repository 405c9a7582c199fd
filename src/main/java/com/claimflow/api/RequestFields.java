package com.claimflow.api;

import java.util.Map;

final class RequestFields {

    private RequestFields() {
    }

    static String requireString(Map<String, Object> body, String field) {
        if (body == null || !(body.get(field) instanceof String text) || text.isBlank()) {
            throw new InvalidRequestException(field + " is required");
        }
        return text;
    }

    /** Absent is allowed, a non-string value is not. */
    static String optionalString(Map<String, Object> body, String field) {
        Object value = body == null ? null : body.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new InvalidRequestException(field + " must be a string");
        }
        return text;
    }
}
