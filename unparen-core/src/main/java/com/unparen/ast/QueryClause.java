package com.unparen.ast;

public sealed interface QueryClause extends SyntaxNode permits FromClause, WhereClause {
}
