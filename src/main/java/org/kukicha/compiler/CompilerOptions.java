package org.kukicha.compiler;

import com.typesafe.config.Config;
import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.frontend.semantics.registry.JsonSignatureRegistryLoader;
import org.kukicha.compiler.frontend.semantics.registry.SignatureRegistry;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Compiler settings, normally read from the {@code kukicha} section of the application config.
 *
 * @param maxErrors          Errors recorded before the diagnostics engine stops collecting.
 * @param emitHeader         Whether generated files start with the generated-code marker.
 * @param signaturesResource Classpath resource of the external signature table.
 * @param signaturesFile     A signature table on disk that replaces the resource, or null.
 */
public record CompilerOptions(int maxErrors, boolean emitHeader, String signaturesResource, Path signaturesFile) {

    public static CompilerOptions defaults() {
        return new CompilerOptions(DiagnosticsEngine.DEFAULT_MAX_ERRORS, true, JsonSignatureRegistryLoader.DEFAULT_RESOURCE, null);
    }

    /**
     * Reads the options from a resolved config holding a {@code kukicha} section.
     *
     * @throws com.typesafe.config.ConfigException if a setting is missing or has the wrong type.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config kukicha = config.getConfig("kukicha");
        return new CompilerOptions(
                kukicha.getInt("compiler.max-errors"),
                kukicha.getBoolean("codegen.emit-header"),
                kukicha.getString("signatures.resource"),
                null);
    }

    public CompilerOptions withSignaturesFile(Path file) {
        return new CompilerOptions(maxErrors, emitHeader, signaturesResource, file);
    }

    public CompilerOptions withEmitHeader(boolean emit) {
        return new CompilerOptions(maxErrors, emit, signaturesResource, signaturesFile);
    }

    /**
     * Loads the signature table these options point at.
     *
     * @throws IOException if the table cannot be read or is malformed.
     */
    public SignatureRegistry loadSignatures() throws IOException {
        if (signaturesFile != null) {
            return JsonSignatureRegistryLoader.loadFile(signaturesFile);
        }
        return JsonSignatureRegistryLoader.loadResource(signaturesResource);
    }
}
