package com.crossplc.analyzer.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies one line of routine text: blank, comment, start or end of a control
 * construct, or a plain statement line.
 *
 * This is a lexical heuristic, not a grammar. A guard written on the same line as its
 * body ({@code IF A THEN B := C; END_IF;}) is split into the condition, the body
 * statements and an inline close marker.
 */
public final class LineClassifier {

    private LineClassifier() {}

    public enum LineKind { BLANK, COMMENT, CONTROL_OPEN, CONTROL_CLOSE, STATEMENT }

    /** An {@code target := value} statement. {@code text} is the statement without its semicolon. */
    public record Assignment(String target, String value, String text) {}

    public record ClassifiedLine(
        String text,
        LineKind kind,
        String keyword,      // IF/FOR/WHILE/CASE, END_*, ELSIF/ELSE, or null
        String condition,    // guard text, or null
        String body,         // statement text after the guard, may be empty
        List<Assignment> assignments,
        boolean closedInline
    ) {
        public boolean isSkippable() {
            return kind == LineKind.BLANK || kind == LineKind.COMMENT;
        }

        public boolean hasCondition() {
            return condition != null && !condition.isEmpty();
        }
    }

    public static final Set<String> OPEN_KEYWORDS = Set.of("IF", "FOR", "WHILE", "CASE");
    public static final Set<String> CLOSE_KEYWORDS = Set.of("END_IF", "END_FOR", "END_WHILE", "END_CASE");

    private static final Pattern LEADING_WORD = Pattern.compile("^([A-Za-z_]+)\\b(.*)$", Pattern.DOTALL);
    private static final Pattern INLINE_CLOSE =
        Pattern.compile("\\b(END_IF|END_FOR|END_WHILE|END_CASE)\\b\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern THEN_GUARD = guardPattern("THEN");
    private static final Pattern OF_GUARD = guardPattern("OF");
    private static final Pattern DO_GUARD = guardPattern("DO");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("^\\(\\*.*\\*\\)$");

    public static ClassifiedLine classify(String rawLine) {
        String line = rawLine == null ? "" : rawLine.strip();
        if (line.isEmpty()) {
            return new ClassifiedLine(line, LineKind.BLANK, null, null, "", List.of(), false);
        }
        if (line.startsWith("//") || BLOCK_COMMENT.matcher(line).matches()) {
            return new ClassifiedLine(line, LineKind.COMMENT, null, null, "", List.of(), false);
        }
        line = stripTrailingComment(line);

        Matcher lead = LEADING_WORD.matcher(line);
        String word = lead.matches() ? lead.group(1).toUpperCase(Locale.ROOT) : "";
        String rest = lead.matches() ? lead.group(2) : "";

        if (CLOSE_KEYWORDS.contains(word)) {
            return new ClassifiedLine(line, LineKind.CONTROL_CLOSE, word, null, "", List.of(), false);
        }
        if (OPEN_KEYWORDS.contains(word)) {
            return guardLine(line, LineKind.CONTROL_OPEN, word, rest);
        }
        if (word.equals("ELSIF")) {
            return guardLine(line, LineKind.STATEMENT, word, rest);
        }
        if (word.equals("ELSE")) {
            String body = rest.strip();
            return new ClassifiedLine(line, LineKind.STATEMENT, word, null, body, assignmentsOf(body), false);
        }
        return new ClassifiedLine(line, LineKind.STATEMENT, null, null, line, assignmentsOf(line), false);
    }

    private static ClassifiedLine guardLine(String line, LineKind kind, String keyword, String rest) {
        Pattern guard = switch (keyword) {
            case "IF", "ELSIF" -> THEN_GUARD;
            case "CASE" -> OF_GUARD;
            default -> DO_GUARD;
        };
        String condition;
        String body = "";
        Matcher m = guard.matcher(rest);
        if (m.matches()) {
            condition = m.group(1).strip();
            body = m.group(2).strip();
        } else {
            condition = stripSemicolon(rest.strip());
        }

        boolean closedInline = false;
        Matcher close = INLINE_CLOSE.matcher(body);
        if (close.find()) {
            body = body.substring(0, close.start()).strip();
            closedInline = true;
        }
        return new ClassifiedLine(line, kind, keyword, condition, body, assignmentsOf(body), closedInline);
    }

    /**
     * Splits {@code text} into statements on semicolons outside string literals and
     * returns those that contain {@code :=}, split at its first occurrence.
     */
    public static List<Assignment> assignmentsOf(String text) {
        if (text == null || !text.contains(":=")) return Collections.emptyList();
        List<Assignment> result = new ArrayList<>();
        for (String statement : splitStatements(text)) {
            int op = statement.indexOf(":=");
            if (op <= 0) continue;
            String target = statement.substring(0, op).strip();
            String value = statement.substring(op + 2).strip();
            if (target.isEmpty()) continue;
            result.add(new Assignment(target, value, statement));
        }
        return result;
    }

    static List<String> splitStatements(String text) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                current.append(c);
            } else if (c == '"' || c == '\'') {
                quote = c;
                current.append(c);
            } else if (c == ';') {
                addStatement(statements, current);
            } else {
                current.append(c);
            }
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder current) {
        String statement = current.toString().strip();
        if (!statement.isEmpty()) statements.add(statement);
        current.setLength(0);
    }

    private static Pattern guardPattern(String terminator) {
        return Pattern.compile("^(.*?)\\b" + terminator + "\\b(.*)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    private static String stripTrailingComment(String line) {
        int idx = line.indexOf("//");
        return idx > 0 ? line.substring(0, idx).strip() : line;
    }

    private static String stripSemicolon(String text) {
        return text.endsWith(";") ? text.substring(0, text.length() - 1).strip() : text;
    }
}
