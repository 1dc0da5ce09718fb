package com.unparen.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Mixin for tokens: the missing flag is written only for tokens synthesized by
 * error recovery. Text may be left out on input for tokens with fixed text.
 */
public abstract class SyntaxTokenMixin {

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    abstract boolean missing();
}
