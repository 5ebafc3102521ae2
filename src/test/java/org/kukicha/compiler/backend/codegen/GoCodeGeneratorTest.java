package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.Compiler;
import org.kukicha.compiler.api.CompilationResult;
import org.kukicha.compiler.api.SourceUnit;
import org.kukicha.compiler.diagnostics.Diagnostic;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.frontend.semantics.registry.SignatureRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GoCodeGeneratorTest {

    private static Compiler compiler;

    @BeforeAll
    static void setUp() {
        compiler = new Compiler();
    }

    private static String compile(String source) {
        CompilationResult result = compiler.compile(SourceUnit.of("main.kuki", source));
        assertThat(result.hasErrors()).as("%s", result.diagnostics()).isFalse();
        return result.files().get(0).content();
    }

    @Test
    @Tag("unit")
    void generatesCompleteFileWithHeaderPackageAndImports() {
        String go = compile("""
                func add(a int, b int) int
                    return a + b

                func main()
                    x := 1
                    y := x |> add(2)
                    print("sum is {y}")
                """);

        assertThat(go).isEqualTo("""
                // Code generated by kukicha. DO NOT EDIT.

                package main

                import (
                \t"fmt"
                )

                func add(a int, b int) int {
                \treturn a + b
                }

                func main() {
                \tx := 1
                \ty := add(x, 2)
                \tfmt.Println(fmt.Sprintf("sum is %v", y))
                }
                """);
    }

    @Test
    @Tag("unit")
    void plainStringLiteralNeedsNoFormatting() {
        String go = compile("""
                func main()
                    print("hello")
                """);

        assertThat(go).contains("\tfmt.Println(\"hello\")\n").doesNotContain("Sprintf");
    }

    @Test
    @Tag("unit")
    void percentSignsInInterpolatedStringsAreEscaped() {
        String go = compile("""
                func report(n int) string
                    return "{n}% done"
                """);

        assertThat(go).contains("return fmt.Sprintf(\"%v%% done\", n)");
    }

    @Test
    @Tag("unit")
    void literalNegativeIndexCountsFromTheEnd() {
        String go = compile("""
                func last(items list of int) int
                    return items[-1]
                """);

        assertThat(go).contains("func last(items []int) int {")
                .contains("\treturn items[len(items)-1]\n");
    }

    @Test
    @Tag("unit")
    void nonLiteralNegativeIndexIsACodeGenerationErrorForThatDeclarationOnly() {
        CompilationResult result = compiler.compile(SourceUnit.of("main.kuki", """
                func pick(items list of int, n int) int
                    return items[-n]

                func first(items list of int) int
                    return items[0]
                """));

        assertThat(result.errors()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(ErrorKind.CODEGEN);
            assertThat(d.message()).isEqualTo("negative index must be an integer literal");
            assertThat(d.line()).isEqualTo(2);
        });
        String go = result.files().get(0).content();
        assertThat(go).doesNotContain("func pick").contains("func first(items []int) int {");
    }

    @Test
    @Tag("unit")
    void structFieldsAreAlignedWithTags() {
        String go = compile("""
                type Todo
                    id int64 as "id"
                    title string json:"title"
                    done bool
                """);

        assertThat(go).contains("""
                type Todo struct {
                \tid    int64  `json:"id"`
                \ttitle string `json:"title"`
                \tdone  bool
                }
                """);
    }

    @Test
    @Tag("unit")
    void methodUsesTheDeclaredReceiverName() {
        String go = compile("""
                type Square
                    side float64

                func Area on sq Square float64
                    return sq.side * sq.side
                """);

        assertThat(go).contains("func (sq Square) Area() float64 {")
                .contains("\treturn sq.side * sq.side\n");
    }

    @Test
    @Tag("unit")
    void interfaceBecomesGoInterface() {
        String go = compile("""
                interface Shape
                    Area() float64
                    Scale(factor float64)
                """);

        assertThat(go).contains("type Shape interface {\n\tArea() float64\n\tScale(factor float64)\n}\n");
    }

    @Test
    @Tag("unit")
    void libraryPlaceholdersBecomeTypeParameters() {
        CompilationResult result = compiler.compile(new SourceUnit("lookup.kuki", """
                func Lookup(m map of any2 to any, key any2) any
                    return m[key]
                """, "collections", true));

        assertThat(result.hasErrors()).as("%s", result.diagnostics()).isFalse();
        String go = result.files().get(0).content();
        assertThat(go).contains("package collections\n")
                .contains("func Lookup[T any, K comparable](m map[K]T, key K) T {");
    }

    @Test
    @Tag("unit")
    void placeholdersStayAnyOutsideLibraries() {
        String go = compile("""
                func Lookup(m map of any2 to any, key any2) any
                    return m[key]
                """);

        assertThat(go).contains("func Lookup(m map[any]any, key any) any {");
    }

    @Test
    @Tag("unit")
    void loopsAndSwitch() {
        String go = compile("""
                func main()
                    total := 0
                    for i from 1 through 3
                        total = total + i
                    switch total
                        when 6
                            print("six")
                        otherwise
                            print("other")
                """);

        assertThat(go).contains("\tfor i := 1; i <= 3; i++ {\n\t\ttotal = total + i\n\t}\n")
                .contains("\tswitch total {\n\tcase 6:\n\t\tfmt.Println(\"six\")\n\tdefault:\n\t\tfmt.Println(\"other\")\n\t}\n");
    }

    @Test
    @Tag("unit")
    void membershipAndDefaultArguments() {
        String go = compile("""
                func greet(name string, greeting string = "hi") string
                    return greeting + " " + name

                func main()
                    items := list of int{1, 2, 3}
                    if 2 in items
                        print(greet("bob"))
                """);

        assertThat(go).contains("\t\"slices\"\n")
                .contains("if slices.Contains(items, 2) {")
                .contains("fmt.Println(greet(\"bob\", \"hi\"))");
    }

    @Test
    @Tag("unit")
    void headerCanBeDisabled() {
        Compiler plain = new Compiler(compiler.getOptions().withEmitHeader(false), SignatureRegistry.empty());

        CompilationResult result = plain.compile(SourceUnit.of("main.kuki", "func main()\n    x := 1\n"));

        assertThat(result.files().get(0).content()).startsWith("package main\n");
    }

    @Test
    @Tag("unit")
    void warningsDoNotPreventGeneration() {
        CompilationResult result = compiler.compile(SourceUnit.of("main.kuki", """
                import "strconv"

                func main()
                    n := strconv.Atoi("1") onerr discard
                    print(n)
                """));

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.warnings()).extracting(Diagnostic::message)
                .anySatisfy(message -> assertThat(message).contains("onerr discard"));
        assertThat(result.files().get(0).content()).contains("\tn, _ := strconv.Atoi(\"1\")\n");
    }

    @Test
    @Tag("unit")
    void mapKeysAreNeverCountedFromTheEnd() {
        String go = compile("""
                func lookup(k int) string
                    m := map of int to string{-1: "minus one"}
                    v := m[-1]
                    w := m[-k]
                    return v + w
                """);

        assertThat(go).contains("\tv := m[-1]\n")
                .contains("\tw := m[-k]\n")
                .doesNotContain("len(m)");
    }

    @Test
    @Tag("unit")
    void negativeIndexOnACallResultIsRejected() {
        CompilationResult result = compiler.compile(SourceUnit.of("main.kuki", """
                func next() list of int
                    return list of int{1, 2}

                func last() int
                    return next()[-1]
                """));

        assertThat(result.errors()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(ErrorKind.CODEGEN);
            assertThat(d.message()).startsWith("negative index needs a variable or field as its target");
        });
        assertThat(result.files().get(0).content()).contains("func next() []int {").doesNotContain("func last");
    }

    @Test
    @Tag("unit")
    void negativeIndexOnAFieldIsRewritten() {
        String go = compile("""
                type Queue
                    items list of int

                func tail(q Queue) int
                    return q.items[-2]
                """);

        assertThat(go).contains("\treturn q.items[len(q.items)-2]\n");
    }

    @Test
    @Tag("unit")
    void literalBoundsFixTheLoopDirection() {
        String go = compile("""
                func countdown()
                    for i from 3 to 0
                        print(i)
                    for j from 1 through 3
                        print(j)
                """);

        assertThat(go).contains("\tfor i := 3; i > 0; i-- {\n")
                .contains("\tfor j := 1; j <= 3; j++ {\n");
    }

    @Test
    @Tag("unit")
    void variableBoundsChooseTheStepAtRunTime() {
        String go = compile("""
                func countdown(n int)
                    for j from n through 1
                        print(j)
                """);

        assertThat(go).contains("""
                \t{
                \t\tstart_1, end_1, step_1 := n, 1, 1
                \t\tif start_1 > end_1 {
                \t\t\tstep_1 = -1
                \t\t}
                \t\tfor j := start_1; j != end_1+step_1; j += step_1 {
                \t\t\tfmt.Println(j)
                \t\t}
                \t}
                """);
    }

    @Test
    @Tag("unit")
    void rangeFromZeroBecomesRangeOverInt() {
        String go = compile("""
                func repeat(n int)
                    for k from 0 to n
                        print(k)
                """);

        assertThat(go).contains("\tfor k := range n {\n");
    }
}
