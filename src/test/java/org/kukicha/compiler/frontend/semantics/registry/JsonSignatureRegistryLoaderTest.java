package org.kukicha.compiler.frontend.semantics.registry;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSignatureRegistryLoaderTest {

    @Test
    @Tag("unit")
    void bundledTableKnowsCommonStandardLibraryCalls() throws IOException {
        MapSignatureRegistry registry = JsonSignatureRegistryLoader.loadResource(JsonSignatureRegistryLoader.DEFAULT_RESOURCE);

        assertThat(registry.size()).isGreaterThan(100);
        assertThat(registry.lookup("strconv.Atoi")).hasValue(2);
        assertThat(registry.lookup("os.ReadFile")).hasValue(2);
        assertThat(registry.lookup("strings.ToUpper")).hasValue(1);
        assertThat(registry.lookup("example.com/nothing.Here")).isEmpty();
    }

    @Test
    @Tag("unit")
    void loadsTableFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("signatures.json");
        Files.writeString(file, "{\"example.com/lib.Fetch\": 2, \"example.com/lib.Close\": 0}");

        MapSignatureRegistry registry = JsonSignatureRegistryLoader.loadFile(file);

        assertThat(registry.lookup("example.com/lib.Fetch")).hasValue(2);
        assertThat(registry.lookup("example.com/lib.Close")).hasValue(0);
    }

    @Test
    @Tag("unit")
    void overridesReplaceAndExtendEntries() throws IOException {
        MapSignatureRegistry base = new MapSignatureRegistry(Map.of("os.ReadFile", 2, "strings.ToUpper", 1));
        MapSignatureRegistry overrides = JsonSignatureRegistryLoader.load(
                new StringReader("{\"strings.ToUpper\": 3, \"example.com/lib.Fetch\": 2}"), "test");

        MapSignatureRegistry merged = base.withOverrides(overrides);

        assertThat(merged.lookup("os.ReadFile")).hasValue(2);
        assertThat(merged.lookup("strings.ToUpper")).hasValue(3);
        assertThat(merged.lookup("example.com/lib.Fetch")).hasValue(2);
    }

    @Test
    @Tag("unit")
    void rejectsNonIntegerCounts() {
        assertThatThrownBy(() -> JsonSignatureRegistryLoader.load(new StringReader("{\"a.B\": 1.5}"), "bad.json"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid return count for 'a.B'");
    }

    @Test
    @Tag("unit")
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> JsonSignatureRegistryLoader.load(new StringReader("{not json"), "bad.json"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("bad.json");
    }

    @Test
    @Tag("unit")
    void rejectsMissingResource() {
        assertThatThrownBy(() -> JsonSignatureRegistryLoader.loadResource("signatures/none.json"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }
}
