package org.kukicha.compiler.frontend.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes source loading for the compiler: local filesystem paths and classpath resources.
 * Content is decoded as UTF-8 and line endings are normalized to {@code \n}.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The name used in diagnostics: the file name for paths, the resource
     *                    path for classpath resources.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The file to read.
     * @return The loaded content, named after the file.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        Path fileName = path.getFileName();
        String logicalName = fileName != null ? fileName.toString() : path.toString().replace('\\', '/');
        return new LoadResult(normalizeLineEndings(content), logicalName);
    }

    /**
     * Loads content from a classpath resource.
     *
     * @param resourcePath The classpath resource path.
     * @return The loaded content and the resource path as logical name.
     * @throws IOException If the resource is not found or cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            return new LoadResult(normalizeLineEndings(content), resourcePath);
        }
    }

    /**
     * Replaces {@code \r\n} and lone {@code \r} with {@code \n}.
     */
    public static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
