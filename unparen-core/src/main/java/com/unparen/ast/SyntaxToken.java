package com.unparen.ast;

import java.util.Objects;

/**
 * An immutable lexical token. A missing token was synthesized by error recovery
 * and has no text.
 *
 * <p>Tokens compare structurally like every record, so two {@code ,} tokens are
 * {@code equals}; a {@link SyntaxTree} tells them apart by identity.</p>
 */
public record SyntaxToken(TokenKind kind, String text, boolean missing) implements SyntaxElement {

    public SyntaxToken {
        Objects.requireNonNull(kind, "kind");
        if (missing) {
            text = "";
        } else if (text == null) {
            if (!kind.hasFixedText()) {
                throw new IllegalArgumentException("Token " + kind + " requires explicit text");
            }
            text = kind.text();
        }
    }

    public static SyntaxToken of(TokenKind kind) {
        return new SyntaxToken(kind, null, false);
    }

    public static SyntaxToken of(TokenKind kind, String text) {
        return new SyntaxToken(kind, Objects.requireNonNull(text, "text"), false);
    }

    public static SyntaxToken missing(TokenKind kind) {
        return new SyntaxToken(kind, "", true);
    }
}
