package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.frontend.lexer.Lexer;
import org.kukicha.compiler.frontend.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Printing a parsed program and parsing the output again yields the same tree, so printing
 * a second time gives identical text.
 */
class AstPrinterRoundTripTest {

    private static Program parse(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Program program = new Parser(new Lexer(source, diagnostics, "main.kuki").scanTokens(), diagnostics, "main.kuki").parse();
        assertThat(diagnostics.hasErrors()).as("%s in:%n%s", diagnostics.getDiagnostics(), source).isFalse();
        return program;
    }

    @ParameterizedTest
    @Tag("unit")
    @DisplayName("print(parse(print(parse(src)))) equals print(parse(src))")
    @ValueSource(strings = {
            """
            petiole shapes

            import "fmt"
            import "encoding/json" as js

            type Point
                x int as "x"
                y int json:"y,omitempty"

            interface Shape
                Area() float64
            """,
            """
            func Area on p reference Point float64
                return 0.0

            func divide(a int, b int) (int, error)
                if b == 0
                    return 0, error "division by zero"
                else if b < 0
                    return -a / -b, empty
                else
                    return a / b, empty
            """,
            """
            func main()
                total := 0
                for i from 0 to 10
                    total = total + i
                for _, name in names
                    print("hello {name}")
                for
                    break
                switch total
                    when 1, 2
                        print("small")
                    otherwise
                        print("large")
            """,
            """
            func process(path string) (string, error)
                data := os.ReadFile(path) onerr return
                text := string(data) |> strings.TrimSpace() |> .ToUpper()
                n := strconv.Atoi(text) onerr 0 explain "not a number"
                check(n) onerr as problem
                    print(problem)
                defer cleanup()
                return text, empty
            """,
            """
            func main()
                items := list of int{1, 2, 3}
                ages := map of string to int{"a": 1}
                last := items[-1]
                part := items[1:]
                ch := make(channel of int, 1)
                send 1 to ch
                v := receive from ch
                go
                    print(v)
                double := (x int) => x * 2
                ok := not (last in items) and part != empty
            """
    })
    void printingIsStableAcrossAReparse(String source) {
        String first = AstPrinter.print(parse(source));
        String second = AstPrinter.print(parse(first));

        assertThat(second).isEqualTo(first);
    }
}
