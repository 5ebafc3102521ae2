package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.frontend.semantics.types.PrimitiveType;
import org.kukicha.compiler.model.Token;
import org.kukicha.compiler.model.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolTableTest {

    private DiagnosticsEngine diagnostics;
    private SymbolTable table;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        table = new SymbolTable(diagnostics);
    }

    private static Symbol variable(String name, int line) {
        Token token = new Token(TokenType.IDENTIFIER, name, null, line, 1, "main.kuki");
        return new Symbol(name, Symbol.Kind.VARIABLE, PrimitiveType.INT, true, token);
    }

    @Test
    @Tag("unit")
    void innerScopeShadowsOuterScope() {
        table.define(variable("x", 1));
        table.enterScope();
        Symbol inner = variable("x", 2);

        assertThat(table.define(inner)).isTrue();
        assertThat(table.resolve("x")).contains(inner);

        table.leaveScope();
        assertThat(table.resolve("x").map(s -> s.token().line())).contains(1);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void redeclarationInTheSameScopeIsReportedAndKeepsTheFirst() {
        table.define(variable("count", 1));

        assertThat(table.define(variable("count", 5))).isFalse();
        assertThat(diagnostics.errorCount()).isEqualTo(1);
        assertThat(diagnostics.getErrors().get(0).message()).contains("'count' is already declared");
        assertThat(table.resolve("count").map(s -> s.token().line())).contains(1);
    }

    @Test
    @Tag("unit")
    void resolveLocalIgnoresEnclosingScopes() {
        table.define(variable("outer", 1));
        table.enterScope();

        assertThat(table.resolveLocal("outer")).isEmpty();
        assertThat(table.resolve("outer")).isPresent();
        assertThat(table.resolve("missing")).isEmpty();
    }

    @Test
    @Tag("unit")
    void resetReturnsToTheRootScope() {
        table.enterScope();
        table.enterScope();

        table.resetScope();

        assertThat(table.getCurrentScope()).isSameAs(table.getRootScope());
        assertThat(table.getRootScope().getChildren()).hasSize(1);
    }
}
