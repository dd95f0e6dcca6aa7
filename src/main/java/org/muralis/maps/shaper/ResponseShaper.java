package org.muralis.maps.shaper;

import org.muralis.maps.result.ToolResponse;

/**
 * Maps a raw provider response onto the stable output shape of one tool.
 * Implementations are stateless and must accept a {@code null} response.
 *
 * @param <T> provider response type
 */
@FunctionalInterface
public interface ResponseShaper<T> {

    ToolResponse shape(T response);
}
