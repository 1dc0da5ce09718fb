package com.unparen;

import com.unparen.ast.ParenthesizedExpression;
import com.unparen.ast.StatementSyntax;
import com.unparen.ast.SyntaxKind;
import com.unparen.ast.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.unparen.ast.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class ConcurrentDecisionsTest {

    private static final int GROUPS = 200;
    private static final int THREADS = 8;
    private static final int ROUNDS = 5;

    @Test
    void testSharedTreeGivesSameAnswersFromManyThreads() throws Exception {
        List<ParenthesizedExpression> nodes = new ArrayList<>();
        List<StatementSyntax> statements = new ArrayList<>();
        for (int i = 0; i < GROUPS; i++) {
            // return (a + b);
            ParenthesizedExpression returned = parenthesized(
                binary(SyntaxKind.ADD_EXPRESSION, identifier("a" + i), identifier("b" + i)));
            statements.add(returnStatement(returned));
            nodes.add(returned);

            // x = (a + b) * c;
            ParenthesizedExpression grouped = parenthesized(
                binary(SyntaxKind.ADD_EXPRESSION, identifier("a" + i), identifier("b" + i)));
            statements.add(expressionStatement(assign(identifier("x" + i),
                binary(SyntaxKind.MULTIPLY_EXPRESSION, grouped, identifier("c" + i)))));
            nodes.add(grouped);

            // y = a + (b * c);
            ParenthesizedExpression product = parenthesized(
                binary(SyntaxKind.MULTIPLY_EXPRESSION, identifier("b" + i), identifier("c" + i)));
            statements.add(expressionStatement(assign(identifier("y" + i),
                binary(SyntaxKind.ADD_EXPRESSION, identifier("a" + i), product))));
            nodes.add(product);
        }
        SyntaxTree tree = SyntaxTree.of(block(statements.toArray(new StatementSyntax[0])));

        List<Boolean> expected = new ArrayList<>();
        for (ParenthesizedExpression node : nodes) {
            expected.add(ParenthesizedExpressions.canRemoveParentheses(tree, node));
        }
        assertTrue(expected.contains(true));
        assertTrue(expected.contains(false));

        List<Callable<Boolean>> tasks = new ArrayList<>();
        for (int round = 0; round < ROUNDS; round++) {
            for (ParenthesizedExpression node : nodes) {
                tasks.add(() -> ParenthesizedExpressions.canRemoveParentheses(tree, node));
            }
        }

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<Boolean>> results = executor.invokeAll(tasks);
            for (int i = 0; i < results.size(); i++) {
                assertEquals(expected.get(i % nodes.size()), results.get(i).get(), "decision " + i);
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        }
    }
}
