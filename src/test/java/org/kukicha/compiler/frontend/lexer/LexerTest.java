package org.kukicha.compiler.frontend.lexer;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.model.StringSegment;
import org.kukicha.compiler.model.Token;
import org.kukicha.compiler.model.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LexerTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private List<Token> scan(String source) {
        return new Lexer(source, diagnostics, "main.kuki").scanTokens();
    }

    private List<TokenType> types(String source) {
        return scan(source).stream().map(Token::type).toList();
    }

    @Test
    @Tag("unit")
    void indentedBlockProducesBalancedIndentAndDedent() {
        String source = """
                func main()
                    if true
                        x := 1
                    y := 2
                """;

        List<TokenType> types = types(source);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types.stream().filter(t -> t == TokenType.INDENT).count())
                .isEqualTo(types.stream().filter(t -> t == TokenType.DEDENT).count())
                .isEqualTo(2);
        assertThat(types).startsWith(TokenType.FUNC, TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.RPAREN,
                TokenType.NEWLINE, TokenType.INDENT, TokenType.IF, TokenType.TRUE);
        assertThat(types).endsWith(TokenType.DEDENT, TokenType.EOF);
    }

    @Test
    @Tag("unit")
    void blankAndCommentLinesDoNotChangeIndentation() {
        String source = """
                func main()
                    x := 1

                # a comment at column one
                    y := 2
                """;

        List<TokenType> types = types(source);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types.stream().filter(t -> t == TokenType.INDENT).count()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void newlinesInsideBracketsDoNotEndTheLine() {
        String source = """
                func main()
                    items := [1,
                        2,
                        3]
                """;

        List<TokenType> types = types(source);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types.stream().filter(t -> t == TokenType.INDENT).count()).isEqualTo(1);
        assertThat(types.stream().filter(t -> t == TokenType.NEWLINE).count()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void tabIndentationIsReportedWithAHint() {
        scan("func main()\n\tx := 1\n");

        assertThat(diagnostics.getErrors(ErrorKind.LEX)).hasSize(1);
        assertThat(diagnostics.getErrors().get(0).message()).contains("not tabs");
        assertThat(diagnostics.getErrors().get(0).hasHint()).isTrue();
    }

    @Test
    @Tag("unit")
    void indentationThatIsNotAMultipleOfFourIsReported() {
        scan("func main()\n  x := 1\n");

        assertThat(diagnostics.getErrors(ErrorKind.LEX)).isNotEmpty();
        assertThat(diagnostics.getErrors().get(0).message()).contains("multiple of 4");
    }

    @Test
    @Tag("unit")
    @SuppressWarnings("unchecked")
    void stringLiteralIsSplitIntoTextAndEmbeddedExpressions() {
        List<Token> tokens = scan("greeting := \"Hello {name}!\"\n");

        Token string = tokens.stream().filter(t -> t.type() == TokenType.STRING).findFirst().orElseThrow();
        List<StringSegment> segments = (List<StringSegment>) string.value();
        assertThat(segments).hasSize(3);
        assertThat(segments.get(0)).isEqualTo(new StringSegment.Text("Hello "));
        assertThat(segments.get(1)).isInstanceOf(StringSegment.Embedded.class);
        StringSegment.Embedded embedded = (StringSegment.Embedded) segments.get(1);
        assertThat(embedded.source()).isEqualTo("name");
        assertThat(embedded.tokens()).extracting(Token::type).containsExactly(TokenType.IDENTIFIER, TokenType.EOF);
        assertThat(segments.get(2)).isEqualTo(new StringSegment.Text("!"));
    }

    @Test
    @Tag("unit")
    @SuppressWarnings("unchecked")
    void plainStringHasASingleTextSegment() {
        List<Token> tokens = scan("s := \"no braces here\"\n");

        Token string = tokens.stream().filter(t -> t.type() == TokenType.STRING).findFirst().orElseThrow();
        assertThat((List<StringSegment>) string.value()).containsExactly(new StringSegment.Text("no braces here"));
    }

    @Test
    @Tag("unit")
    void unterminatedStringIsReportedAndScanningContinues() {
        List<Token> tokens = scan("s := \"open\nt := 1\n");

        assertThat(diagnostics.getErrors(ErrorKind.LEX)).extracting(d -> d.message()).contains("Unterminated string");
        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.EOF);
    }

    @Test
    @Tag("unit")
    void keywordsAndOperatorsAreRecognized() {
        List<TokenType> types = types("x := a |> f() onerr return\n");

        assertThat(types).containsSubsequence(TokenType.IDENTIFIER, TokenType.WALRUS, TokenType.IDENTIFIER,
                TokenType.PIPE, TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.RPAREN, TokenType.ONERR, TokenType.RETURN);
    }

    @Test
    @Tag("unit")
    void tokensCarryLineAndColumn() {
        List<Token> tokens = scan("func main()\n    total := 10\n");

        Token total = tokens.stream().filter(t -> t.text().equals("total")).findFirst().orElseThrow();
        assertThat(total.line()).isEqualTo(2);
        assertThat(total.column()).isEqualTo(5);
        assertThat(total.fileName()).isEqualTo("main.kuki");
    }
}
