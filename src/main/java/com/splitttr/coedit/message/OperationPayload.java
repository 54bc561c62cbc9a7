package com.splitttr.coedit.message;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationPayload(
    String content,             // insert / replace
    Integer length,             // delete / replace / format span
    Map<String, Object> format, // format attributes
    CursorPosition targetPosition // move destination
) {
    public OperationPayload {
        format = format == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(format));
    }

    public static OperationPayload text(String content) {
        return new OperationPayload(content, null, null, null);
    }

    public static OperationPayload span(int length) {
        return new OperationPayload(null, length, null, null);
    }

    public static OperationPayload formatting(int length, Map<String, Object> format) {
        return new OperationPayload(null, length, format, null);
    }

    public static OperationPayload moveTo(int length, CursorPosition target) {
        return new OperationPayload(null, length, null, target);
    }
}
