package org.pragmatica.harel.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reserved words of the statechart language.
 */
public enum Keyword {
    STATECHART("statechart"),
    STATE("state"),
    REGION("region"),
    ON("on"),
    ENTRY("entry"),
    EXIT("exit"),
    INITIAL("initial"),
    FINAL("final"),
    HISTORY("history"),
    DEEP("deep");

    private static final Map<String, Keyword> BY_TEXT = Arrays.stream(values())
                                                              .collect(Collectors.toUnmodifiableMap(Keyword::text,
                                                                                                    Function.identity()));

    private final String text;

    Keyword(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public static Optional<Keyword> lookup(String word) {
        return Optional.ofNullable(BY_TEXT.get(word));
    }
}
