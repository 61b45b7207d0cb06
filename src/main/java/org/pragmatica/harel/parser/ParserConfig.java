package org.pragmatica.harel.parser;

/**
 * Parser configuration options.
 *
 * @param maxInputSize    largest accepted source, in characters
 * @param maxNestingDepth deepest accepted state nesting; top-level states are at depth 1
 */
public record ParserConfig(
    int maxInputSize,
    int maxNestingDepth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        1_000_000,
        128
    );

    public ParserConfig {
        if (maxInputSize <= 0) {
            throw new IllegalArgumentException("maxInputSize must be positive");
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive");
        }
    }

    public ParserConfig withMaxNestingDepth(int depth) {
        return new ParserConfig(maxInputSize, depth);
    }

    public ParserConfig withMaxInputSize(int size) {
        return new ParserConfig(size, maxNestingDepth);
    }
}
