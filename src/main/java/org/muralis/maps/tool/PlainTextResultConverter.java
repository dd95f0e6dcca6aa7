package org.muralis.maps.tool;

import org.springframework.ai.tool.execution.DefaultToolCallResultConverter;
import org.springframework.ai.tool.execution.ToolCallResultConverter;
import org.springframework.lang.Nullable;

import java.lang.reflect.Type;

/**
 * Passes string tool results through untouched. The tools already render compact JSON or a
 * plain sentence, which the default converter would wrap in quotes.
 */
public class PlainTextResultConverter implements ToolCallResultConverter {

    private final ToolCallResultConverter fallback = new DefaultToolCallResultConverter();

    @Override
    public String convert(@Nullable Object result, @Nullable Type returnType) {
        if (result instanceof String text) {
            return text;
        }
        return fallback.convert(result, returnType);
    }
}
