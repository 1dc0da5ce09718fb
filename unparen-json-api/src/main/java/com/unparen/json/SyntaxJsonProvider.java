package com.unparen.json;

import com.unparen.ast.SyntaxNode;
import com.unparen.ast.SyntaxTree;

import java.util.ServiceLoader;

/**
 * A JSON binding for syntax trees, found at run time through
 * {@link ServiceLoader}. Trees arrive from an external parser as JSON, so the
 * usual entry point is {@link #readTree(String)}:
 *
 * <pre>{@code
 * SyntaxTree tree = SyntaxJsonProvider.readTree(json);
 * boolean removable = ParenthesizedExpressions.canRemoveParentheses(tree, node);
 * }</pre>
 *
 * <p>{@code unparen-jackson} registers the {@code "Jackson"} binding.</p>
 */
public interface SyntaxJsonProvider {

    SyntaxJsonSerializer getSerializer();

    SyntaxJsonDeserializer getDeserializer();

    /**
     * The name {@link #getProvider(String)} matches against, ignoring case.
     */
    String getName();

    /**
     * The first binding on the class path.
     *
     * @throws IllegalStateException if there is none
     */
    static SyntaxJsonProvider getProvider() {
        return ServiceLoader.load(SyntaxJsonProvider.class).findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No syntax JSON binding on the class path; add unparen-jackson to the dependencies"));
    }

    /**
     * The binding registered under {@code name}.
     *
     * @throws IllegalStateException if no binding has that name
     */
    static SyntaxJsonProvider getProvider(String name) {
        for (SyntaxJsonProvider provider : ServiceLoader.load(SyntaxJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No syntax JSON binding named '" + name + "' on the class path");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(SyntaxJsonProvider.class).findFirst().isPresent();
    }

    /**
     * Reads a tree with the first binding on the class path.
     *
     * @throws SyntaxJsonException if {@code json} is not a well-formed tree
     * @throws IllegalStateException if no binding is available
     */
    static SyntaxTree readTree(String json) {
        return getProvider().getDeserializer().deserializeTree(json);
    }

    /**
     * Writes {@code node} and everything below it with the first binding on
     * the class path.
     *
     * @throws SyntaxJsonException if the node cannot be written
     * @throws IllegalStateException if no binding is available
     */
    static String write(SyntaxNode node) {
        return getProvider().getSerializer().serialize(node);
    }
}
