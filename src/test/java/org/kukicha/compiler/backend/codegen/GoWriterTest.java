package org.kukicha.compiler.backend.codegen;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoWriterTest {

    @Test
    @Tag("unit")
    void indentsBlocksWithTabs() {
        GoWriter out = new GoWriter();

        out.open("func main() {")
                .open("if ok {")
                .line("return")
                .close("}")
                .close("}");

        assertThat(out.toString()).isEqualTo("func main() {\n\tif ok {\n\t\treturn\n\t}\n}\n");
        assertThat(out.level()).isZero();
    }

    @Test
    @Tag("unit")
    void nestedWriterStartsOneLevelDeeper() {
        GoWriter out = new GoWriter(1);

        GoWriter nested = out.nested().line("x := 1");

        assertThat(nested.toString()).isEqualTo("\t\tx := 1\n");
        assertThat(nested.padding()).isEqualTo("\t\t");
        assertThat(out.isEmpty()).isTrue();
    }

    @Test
    @Tag("unit")
    void rawTextIsNotIndented() {
        GoWriter out = new GoWriter(2);

        out.raw("// header\n").blank();

        assertThat(out.toString()).isEqualTo("// header\n\n");
    }

    @Test
    @Tag("unit")
    void dedentBelowZeroIsRejected() {
        GoWriter out = new GoWriter();

        assertThatThrownBy(out::dedent).isInstanceOf(IllegalStateException.class);
    }
}
