package info.isaksson.erland.tonto.diagnostics;

/** Position helpers over raw source text. Offsets are 0-based, lines and columns 1-based. */
public final class SourceText {
    private SourceText() {}

    /** Column of {@code offset}, found by scanning back to the previous newline. */
    public static int column(String text, int offset) {
        int lineStart = lineStart(text, offset);
        return (offset - lineStart) + 1;
    }

    /** Full text of the line containing {@code offset}, without its line terminator. */
    public static String lineText(String text, int offset) {
        if (text == null || text.isEmpty()) return "";
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int start = lineStart(text, clamped);
        int end = text.indexOf('\n', clamped);
        if (end < 0) end = text.length();
        String line = text.substring(start, end);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /** Caret under {@code column}: {@code column - 1} spaces followed by {@code ^}. */
    public static String pointer(int column) {
        return " ".repeat(Math.max(0, column - 1)) + "^";
    }

    private static int lineStart(String text, int offset) {
        if (text == null || offset <= 0) return 0;
        int from = Math.min(offset, text.length()) - 1;
        return text.lastIndexOf('\n', from) + 1;
    }
}
