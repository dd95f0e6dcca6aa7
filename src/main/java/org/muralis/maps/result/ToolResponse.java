package org.muralis.maps.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of one tool call: a result object, a plain-text not-found sentence, or an error payload.
 * Results and errors render as compact JSON; not-found sentences render verbatim.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ToolResponse {

    public enum Kind { RESULT, NOT_FOUND, ERROR }

    private final Kind kind;
    private final Object payload;
    private final String message;

    public static ToolResponse of(Object payload) {
        return new ToolResponse(Kind.RESULT, payload, null);
    }

    public static ToolResponse notFound(String message) {
        return new ToolResponse(Kind.NOT_FOUND, null, message);
    }

    public static ToolResponse error(ErrorPayload error) {
        return new ToolResponse(Kind.ERROR, error, error.error());
    }

    public boolean isNotFound() {
        return kind == Kind.NOT_FOUND;
    }

    public String render(ObjectMapper objectMapper) throws JsonProcessingException {
        if (kind == Kind.NOT_FOUND) {
            return message;
        }
        return objectMapper.writeValueAsString(payload);
    }
}
