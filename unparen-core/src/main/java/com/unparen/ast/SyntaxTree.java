package com.unparen.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable snapshot of a syntax tree with upward and token-order navigation.
 *
 * <p>Records carry no parent pointer, so the tree indexes every element by
 * identity when it is built. Structurally equal elements (the two {@code a}s of
 * {@code a + a}) are distinct entries; reusing one element instance twice in a
 * tree is rejected.</p>
 *
 * <p>Walks use an explicit stack, so nesting depth is bounded by memory rather
 * than by the thread's stack.</p>
 *
 * <p>Instances are safe to share between threads.</p>
 */
public final class SyntaxTree {

    private final SyntaxNode root;
    private final Map<SyntaxElement, SyntaxNode> parents = new IdentityHashMap<>();
    private final List<SyntaxToken> tokens = new ArrayList<>();
    private final Map<SyntaxToken, Integer> tokenIndex = new IdentityHashMap<>();

    private SyntaxTree(SyntaxNode root) {
        this.root = root;
        index();
    }

    /**
     * Builds a tree over {@code root}.
     *
     * @throws IllegalArgumentException if an element instance occurs more than once
     */
    public static SyntaxTree of(SyntaxNode root) {
        return new SyntaxTree(Objects.requireNonNull(root, "root"));
    }

    public SyntaxNode root() {
        return root;
    }

    public boolean contains(SyntaxElement element) {
        return element == root || parents.containsKey(element);
    }

    /**
     * The node that directly owns {@code element}, or {@code null} for the root.
     */
    public SyntaxNode parent(SyntaxElement element) {
        requireMember(element);
        return parents.get(element);
    }

    /**
     * The parent of {@code node}, looking through a {@link ConstantPattern}
     * wrapper: in {@code x is (y)} the logical parent of {@code (y)} is the
     * {@code is} expression.
     */
    public SyntaxNode logicalParent(SyntaxNode node) {
        SyntaxNode parent = parent(node);
        if (parent instanceof ConstantPattern) {
            return parents.get(parent);
        }
        return parent;
    }

    /**
     * {@code node} followed by each of its ancestors up to the root.
     */
    public List<SyntaxNode> ancestorsAndSelf(SyntaxNode node) {
        requireMember(node);
        List<SyntaxNode> chain = new ArrayList<>();
        for (SyntaxNode current = node; current != null; current = parents.get(current)) {
            chain.add(current);
        }
        return chain;
    }

    /**
     * The first non-missing token under {@code node}, or {@code null} if it has none.
     */
    public SyntaxToken firstToken(SyntaxNode node) {
        requireMember(node);
        Deque<SyntaxElement> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            SyntaxElement element = stack.pop();
            if (element instanceof SyntaxToken token) {
                if (!token.missing()) {
                    return token;
                }
            } else {
                pushReversed(stack, ((SyntaxNode) element).childNodesAndTokens());
            }
        }
        return null;
    }

    /**
     * The non-missing token that precedes {@code token} in document order, or
     * {@code null} at the start of the tree.
     */
    public SyntaxToken previousToken(SyntaxToken token) {
        requireMember(token);
        Integer index = tokenIndex.get(token);
        int start = index == null ? precedingIndex(token) : index - 1;
        return start >= 0 ? tokens.get(start) : null;
    }

    /**
     * Every non-missing token in document order.
     */
    public List<SyntaxToken> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    /**
     * The source text of {@code node}: its tokens joined by single spaces.
     */
    public static String textOf(SyntaxNode node) {
        StringBuilder text = new StringBuilder();
        Deque<SyntaxElement> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            SyntaxElement element = stack.pop();
            if (element instanceof SyntaxToken token) {
                if (!token.text().isEmpty()) {
                    if (text.length() > 0) {
                        text.append(' ');
                    }
                    text.append(token.text());
                }
            } else {
                pushReversed(stack, ((SyntaxNode) element).childNodesAndTokens());
            }
        }
        return text.toString();
    }

    private void index() {
        Deque<SyntaxElement> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxElement element = stack.pop();
            if (element instanceof SyntaxToken token) {
                if (!token.missing()) {
                    tokenIndex.put(token, tokens.size());
                    tokens.add(token);
                }
                continue;
            }
            SyntaxNode node = (SyntaxNode) element;
            List<SyntaxElement> children = node.childNodesAndTokens();
            for (SyntaxElement child : children) {
                if (child == root || parents.put(child, node) != null) {
                    throw new IllegalArgumentException("Element occurs more than once in the tree: " + describe(child));
                }
            }
            pushReversed(stack, children);
        }
    }

    // Children go on in reverse so they come off in document order.
    private static void pushReversed(Deque<SyntaxElement> stack, List<SyntaxElement> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    // A missing token is not in the token index; find the last real token before it.
    private int precedingIndex(SyntaxToken missingToken) {
        SyntaxElement current = missingToken;
        SyntaxNode parent = parents.get(current);
        while (parent != null) {
            List<SyntaxElement> siblings = parent.childNodesAndTokens();
            for (int i = indexOf(siblings, current) - 1; i >= 0; i--) {
                SyntaxToken last = lastToken(siblings.get(i));
                if (last != null) {
                    return tokenIndex.get(last);
                }
            }
            current = parent;
            parent = parents.get(parent);
        }
        return -1;
    }

    private static SyntaxToken lastToken(SyntaxElement element) {
        Deque<SyntaxElement> stack = new ArrayDeque<>();
        stack.push(element);
        while (!stack.isEmpty()) {
            SyntaxElement current = stack.pop();
            if (current instanceof SyntaxToken token) {
                if (!token.missing()) {
                    return token;
                }
            } else {
                // pushed in document order, so the last child is popped first
                for (SyntaxElement child : ((SyntaxNode) current).childNodesAndTokens()) {
                    stack.push(child);
                }
            }
        }
        return null;
    }

    private static int indexOf(List<? extends SyntaxElement> elements, SyntaxElement element) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == element) {
                return i;
            }
        }
        return -1;
    }

    private void requireMember(SyntaxElement element) {
        Objects.requireNonNull(element, "element");
        if (!contains(element)) {
            throw new IllegalArgumentException("Element is not part of this tree: " + describe(element));
        }
    }

    private static String describe(SyntaxElement element) {
        if (element instanceof SyntaxToken token) {
            return token.kind() + " '" + token.text() + "'";
        }
        return ((SyntaxNode) element).kind().name();
    }
}
