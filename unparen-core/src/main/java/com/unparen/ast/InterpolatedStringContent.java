package com.unparen.ast;

/**
 * A fragment of an interpolated string: literal text or an interpolation hole.
 */
public sealed interface InterpolatedStringContent extends SyntaxNode permits InterpolatedStringText, Interpolation {
}
