package org.kukicha.compiler.backend.codegen;

/**
 * Line-oriented output buffer with tab indentation, as gofmt lays Go source out.
 */
public final class GoWriter {

    private final StringBuilder sb = new StringBuilder();
    private int level;

    public GoWriter() {
        this(0);
    }

    public GoWriter(int level) {
        this.level = level;
    }

    /**
     * Writes one line at the current indentation.
     */
    public GoWriter line(String text) {
        pad(level);
        sb.append(text).append('\n');
        return this;
    }

    /**
     * Writes a line and indents everything after it.
     */
    public GoWriter open(String text) {
        line(text);
        level++;
        return this;
    }

    /**
     * Dedents and writes the closing line.
     */
    public GoWriter close(String text) {
        level--;
        return line(text);
    }

    public GoWriter indent() {
        level++;
        return this;
    }

    public GoWriter dedent() {
        if (level == 0) {
            throw new IllegalStateException("Unbalanced dedent");
        }
        level--;
        return this;
    }

    public GoWriter blank() {
        sb.append('\n');
        return this;
    }

    /**
     * Appends already formatted text without indentation.
     */
    public GoWriter raw(String text) {
        sb.append(text);
        return this;
    }

    public int level() {
        return level;
    }

    /**
     * Creates a writer for a nested body, one level deeper than this one.
     */
    public GoWriter nested() {
        return new GoWriter(level + 1);
    }

    /**
     * The tabs of the current indentation level.
     */
    public String padding() {
        return "\t".repeat(level);
    }

    public boolean isEmpty() {
        return sb.length() == 0;
    }

    private void pad(int n) {
        for (int i = 0; i < n; i++) {
            sb.append('\t');
        }
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
