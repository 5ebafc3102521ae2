package org.kukicha.compiler.frontend.semantics.registry;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds a {@link MapSignatureRegistry} from a JSON object mapping qualified function names to
 * return counts:
 * <pre>
 * {
 *   "strconv.Atoi": 2,
 *   "encoding/json.Marshal": 2,
 *   "os.Exit": 0
 * }
 * </pre>
 */
public final class JsonSignatureRegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonSignatureRegistryLoader.class);

    /** The table bundled with the compiler. */
    public static final String DEFAULT_RESOURCE = "signatures/go-stdlib.json";

    private JsonSignatureRegistryLoader() {
    }

    /**
     * Parses a signature table.
     * @param reader The JSON source. Not closed by this method.
     * @param sourceName A name for the source, used in error messages.
     * @return The registry.
     * @throws IOException if the source cannot be read or is not a valid signature table.
     */
    public static MapSignatureRegistry load(Reader reader, String sourceName) throws IOException {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IOException("Malformed signature table " + sourceName + ": " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new IOException("Signature table " + sourceName + " must be a JSON object");
        }
        JsonObject object = root.getAsJsonObject();
        Map<String, Integer> counts = new HashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            counts.put(entry.getKey(), returnCount(entry.getKey(), entry.getValue(), sourceName));
        }
        log.debug("Loaded {} signatures from {}", counts.size(), sourceName);
        return new MapSignatureRegistry(counts);
    }

    /**
     * Loads a signature table from a file.
     */
    public static MapSignatureRegistry loadFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        }
    }

    /**
     * Loads a signature table from the classpath.
     * @param resource The resource path, e.g. {@value #DEFAULT_RESOURCE}.
     * @throws IOException if the resource does not exist or is malformed.
     */
    public static MapSignatureRegistry loadResource(String resource) throws IOException {
        InputStream in = JsonSignatureRegistryLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IOException("Signature table resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader, "classpath:" + resource);
        }
    }

    private static int returnCount(String name, JsonElement value, String sourceName) throws IOException {
        if (value instanceof JsonPrimitive primitive && primitive.isNumber()) {
            double number = primitive.getAsDouble();
            if (number >= 0 && number == Math.rint(number)) {
                return (int) number;
            }
        }
        throw new IOException("Invalid return count for '" + name + "' in " + sourceName + ": " + value);
    }
}
