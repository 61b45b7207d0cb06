package org.pragmatica.harel.lexer;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy token sequence. Each iteration lexes the source again from the beginning.
 */
public final class Tokens implements Iterable<Token> {
    private final String source;

    Tokens(String source) {
        this.source = source;
    }

    public String source() {
        return source;
    }

    @Override
    public Iterator<Token> iterator() {
        return Lexer.over(source);
    }

    public Stream<Token> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false);
    }
}
