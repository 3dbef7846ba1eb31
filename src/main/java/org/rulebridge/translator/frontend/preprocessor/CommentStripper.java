package org.rulebridge.translator.frontend.preprocessor;

/**
 * Removes C-style block comments from raw deck text before any structural analysis.
 * <p>
 * Block comments do not nest: the first {@code *}{@code /} closes the comment.
 * Newlines inside a removed comment are kept so that line numbers of the
 * remaining text stay valid. An opener without a closer is not a comment and is kept.
 */
public final class CommentStripper {

    private static final String OPEN = "/*";
    private static final String CLOSE = "*/";

    private CommentStripper() {}

    /**
     * @param source The raw deck text.
     * @return The text with every block comment removed.
     */
    public static String strip(String source) {
        StringBuilder out = new StringBuilder(source.length());
        int pos = 0;
        while (pos < source.length()) {
            int open = source.indexOf(OPEN, pos);
            if (open < 0) {
                out.append(source, pos, source.length());
                break;
            }
            int close = source.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                out.append(source, pos, source.length());
                break;
            }
            out.append(source, pos, open);
            int end = close + CLOSE.length();
            for (int i = open; i < end; i++) {
                if (source.charAt(i) == '\n') {
                    out.append('\n');
                }
            }
            pos = end;
        }
        return out.toString();
    }
}
