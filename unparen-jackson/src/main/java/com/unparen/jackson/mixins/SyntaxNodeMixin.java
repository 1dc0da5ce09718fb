package com.unparen.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Mixin that marks every syntax node with a {@code "syntax"} type id naming its record.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "syntax")
public interface SyntaxNodeMixin {
}
