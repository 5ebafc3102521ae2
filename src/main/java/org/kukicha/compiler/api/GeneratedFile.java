package org.kukicha.compiler.api;

/**
 * A generated Go source file.
 *
 * @param sourceFileName The Kukicha file it was generated from.
 * @param goFileName     The output file name: the source name with {@code .kuki} replaced by {@code .go}.
 * @param content        The Go source text.
 */
public record GeneratedFile(String sourceFileName, String goFileName, String content) {

    /**
     * Derives the Go file name of a Kukicha source file.
     */
    public static String goFileName(String sourceFileName) {
        if (sourceFileName.endsWith(".kuki")) {
            return sourceFileName.substring(0, sourceFileName.length() - ".kuki".length()) + ".go";
        }
        return sourceFileName + ".go";
    }
}
