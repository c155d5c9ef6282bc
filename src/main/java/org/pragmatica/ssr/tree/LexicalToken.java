package org.pragmatica.ssr.tree;

import com.github.javaparser.JavaToken;

/**
 * One token of a parsed unit, including whitespace and comments, positioned by character offsets.
 */
public record LexicalToken(Span span, JavaToken.Category category, String text) {

    public boolean isComment() {
        return category.isComment();
    }

    public boolean isIdentifier() {
        return category == JavaToken.Category.IDENTIFIER;
    }

    public boolean isWhitespace() {
        return category.isWhitespace();
    }

    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }
}
