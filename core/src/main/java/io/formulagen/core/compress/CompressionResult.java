package io.formulagen.core.compress;

import java.util.Objects;

/**
 * Result of compressing a formula.
 *
 * @param text         compressed formula text
 * @param depthReached deepest level of inlining that took place; 0 when nothing was inlined
 */
public record CompressionResult(String text, int depthReached) {

    public CompressionResult {
        Objects.requireNonNull(text, "text must not be null");
    }
}
