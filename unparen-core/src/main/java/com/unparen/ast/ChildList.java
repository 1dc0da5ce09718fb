package com.unparen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the ordered child lists returned by {@link SyntaxNode#childNodesAndTokens()}.
 */
final class ChildList {

    private ChildList() {
    }

    /**
     * Flattens slots into one list. Each part is a {@link SyntaxElement}, a list
     * of elements, or {@code null} for an absent optional slot.
     */
    static List<SyntaxElement> of(Object... parts) {
        List<SyntaxElement> children = new ArrayList<>();
        for (Object part : parts) {
            if (part == null) {
                continue;
            }
            if (part instanceof SyntaxElement element) {
                children.add(element);
            } else if (part instanceof List<?> list) {
                for (Object item : list) {
                    children.add((SyntaxElement) item);
                }
            } else {
                throw new IllegalArgumentException("Not a syntax element: " + part.getClass().getName());
            }
        }
        return Collections.unmodifiableList(children);
    }

    /**
     * Interleaves list nodes with their separators: {@code a , b , c}.
     */
    static List<SyntaxElement> separated(List<? extends SyntaxNode> nodes, List<SyntaxToken> separators) {
        List<SyntaxElement> children = new ArrayList<>(nodes.size() + separators.size());
        for (int i = 0; i < nodes.size(); i++) {
            children.add(nodes.get(i));
            if (i < separators.size()) {
                children.add(separators.get(i));
            }
        }
        return children;
    }

    /**
     * Copies a separated list's parts, treating {@code null} as empty. A list of
     * n nodes has n - 1 separators, or n with a trailing separator.
     */
    static <T extends SyntaxNode> List<T> nodes(List<T> nodes, List<SyntaxToken> separators, String owner) {
        List<T> copy = nodes == null ? List.of() : List.copyOf(nodes);
        int count = separators == null ? 0 : separators.size();
        boolean valid = copy.isEmpty() ? count == 0 : count == copy.size() - 1 || count == copy.size();
        if (!valid) {
            throw new IllegalArgumentException(owner + " has " + copy.size() + " elements but " + count + " separators");
        }
        return copy;
    }

    static List<SyntaxToken> separators(List<SyntaxToken> separators) {
        return separators == null ? List.of() : List.copyOf(separators);
    }

    static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
