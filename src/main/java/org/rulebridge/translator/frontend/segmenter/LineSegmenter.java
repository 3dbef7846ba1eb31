package org.rulebridge.translator.frontend.segmenter;

import org.rulebridge.translator.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits comment-free deck text into logical statements, in source order.
 * <p>
 * Classification is line-oriented and checked in this order:
 * <ol>
 *   <li>blank lines and {@code //} lines are dropped,</li>
 *   <li>a line whose first word is {@code LAYER} is a layer declaration,</li>
 *   <li>a line containing {@code {} opens a rule block that extends until its braces balance,</li>
 *   <li>a line containing {@code =} is an assignment,</li>
 *   <li>anything else is ignorable.</li>
 * </ol>
 */
public class LineSegmenter {

    private static final String LAYER_KEYWORD = "LAYER";

    private final String fileName;

    /**
     * @param fileName The deck name recorded in every statement's source position.
     */
    public LineSegmenter(String fileName) {
        this.fileName = fileName;
    }

    /**
     * @param source Deck text with block comments already removed.
     * @return The statements in source order.
     */
    public List<Statement> segment(String source) {
        String[] lines = source.split("\n", -1);
        List<Statement> statements = new ArrayList<>();
        int i = 0;
        while (i < lines.length) {
            String line = lines[i].strip();
            SourceInfo info = new SourceInfo(fileName, i + 1, line);

            if (line.isEmpty() || line.startsWith("//")) {
                i++;
            } else if (firstWord(line).equals(LAYER_KEYWORD)) {
                statements.add(new LayerDeclStatement(line, info));
                i++;
            } else if (line.indexOf('{') >= 0) {
                i = readRuleBlock(lines, i, info, statements);
            } else if (line.indexOf('=') >= 0) {
                int at = line.indexOf('@');
                String text = at >= 0 ? line.substring(0, at).strip() : line;
                String annotation = at >= 0 ? emptyToNull(line.substring(at + 1)) : null;
                statements.add(new AssignmentStatement(text, annotation, info));
                i++;
            } else {
                statements.add(new IgnorableStatement(info));
                i++;
            }
        }
        return statements;
    }

    /**
     * Consumes a rule block starting at {@code start}. Every {@code @} line of the body is
     * removed from it; the annotation texts are joined with single spaces.
     * @return The index of the first line after the block.
     */
    private int readRuleBlock(String[] lines, int start, SourceInfo info, List<Statement> out) {
        String opening = info.lineContent();
        int brace = opening.indexOf('{');
        int at = opening.indexOf('@');

        String name;
        List<String> notes = new ArrayList<>();
        StringBuilder body = new StringBuilder();
        if (at >= 0 && at < brace) {
            // NAME @ TEXT { ...
            name = opening.substring(0, at).strip();
            addNote(notes, opening.substring(at + 1, brace));
            body.append(opening.substring(brace));
        } else if (at >= 0) {
            // NAME { @ TEXT } ...
            name = opening.substring(0, brace).strip();
            int end = annotationEnd(opening, at);
            addNote(notes, opening.substring(at + 1, end));
            body.append(opening, brace, at).append(opening.substring(end));
        } else {
            name = opening.substring(0, brace).strip();
            body.append(opening.substring(brace));
        }

        int depth = braceDelta(opening);
        int i = start + 1;
        while (i < lines.length && depth > 0) {
            String raw = lines[i];
            depth += braceDelta(raw);
            String trimmed = raw.strip();
            if (trimmed.startsWith("@")) {
                int end = annotationEnd(trimmed, 0);
                addNote(notes, trimmed.substring(1, end));
                body.append('\n').append(trimmed.substring(end));
            } else {
                body.append('\n').append(raw);
            }
            i++;
        }
        String annotation = notes.isEmpty() ? null : String.join(" ", notes);
        out.add(new RuleBlockStatement(name, body.toString(), annotation, info));
        return i;
    }

    private static void addNote(List<String> notes, String text) {
        String note = emptyToNull(text);
        if (note != null) {
            notes.add(note);
        }
    }

    private static int annotationEnd(String line, int at) {
        int close = line.indexOf('}', at);
        return close < 0 ? line.length() : close;
    }

    private static int braceDelta(String line) {
        int delta = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '{') delta++;
            else if (c == '}') delta--;
        }
        return delta;
    }

    private static String firstWord(String line) {
        int end = 0;
        while (end < line.length() && !Character.isWhitespace(line.charAt(end))) end++;
        return line.substring(0, end);
    }

    private static String emptyToNull(String text) {
        String stripped = text.strip();
        return stripped.isEmpty() ? null : stripped;
    }
}
