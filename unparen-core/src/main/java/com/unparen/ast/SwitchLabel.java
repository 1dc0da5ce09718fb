package com.unparen.ast;

public sealed interface SwitchLabel extends SyntaxNode permits CaseSwitchLabel, CasePatternSwitchLabel, DefaultSwitchLabel {
}
