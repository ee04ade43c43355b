package com.crossplc.analyzer.fsm;

import com.crossplc.analyzer.ir.IrModel.IrProgram;
import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrModel.IrRoutine;
import com.crossplc.analyzer.text.LineClassifier;
import com.crossplc.analyzer.text.LineClassifier.Assignment;
import com.crossplc.analyzer.text.LineClassifier.ClassifiedLine;
import com.crossplc.analyzer.text.LineClassifier.LineKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assignments, guards and output assignments found in every routine of one project,
 * in routine and line order. This is the only input the FSM heuristics look at.
 */
public final class ControlFlowFacts {

    public enum GuardKind { IF, ELSIF, CASE, WHILE, FOR }

    public record AssignmentFact(String variable, String value, String line) {}

    public record GuardFact(GuardKind kind, String condition, List<String> variables, String line) {
        public boolean mentions(String variable) {
            return variables.contains(variable);
        }
    }

    public record OutputFact(String variable, String value, String line) {}

    private static final Pattern OUTPUT_VALUE =
        Pattern.compile("TRUE|FALSE|1|0|ON|OFF|OPEN|CLOSE", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONDITION_TOKEN = Pattern.compile("\"([^\"]*)\"|'([^']*)'|(\\w+)");
    private static final Set<String> OPERATORS = Set.of("AND", "OR", "NOT", "XOR", "MOD", "TO", "BY");

    private final List<AssignmentFact> assignments = new ArrayList<>();
    private final List<GuardFact> guards = new ArrayList<>();
    private final List<OutputFact> outputs = new ArrayList<>();

    public static ControlFlowFacts extract(IrProject project) {
        ControlFlowFacts facts = new ControlFlowFacts();
        for (IrProgram program : project.programs) {
            for (IrRoutine routine : program.routines) {
                if (routine.hasContent()) {
                    facts.scan(routine.content);
                }
            }
        }
        return facts;
    }

    /** Facts of a single piece of routine text. */
    public static ControlFlowFacts of(String content) {
        ControlFlowFacts facts = new ControlFlowFacts();
        if (content != null) {
            facts.scan(content);
        }
        return facts;
    }

    private void scan(String content) {
        for (String rawLine : content.split("\\R")) {
            ClassifiedLine line = LineClassifier.classify(rawLine);
            if (line.isSkippable()) continue;

            GuardKind kind = guardKind(line);
            if (kind != null && line.hasCondition()) {
                guards.add(new GuardFact(kind, line.condition(), conditionVariables(line.condition()), line.text()));
            }
            for (Assignment assignment : line.assignments()) {
                String variable = stripIndex(stripCaseLabel(assignment.target()));
                String value = stripQuotes(assignment.value());
                assignments.add(new AssignmentFact(variable, value, line.text()));
                if (OUTPUT_VALUE.matcher(value).matches()) {
                    outputs.add(new OutputFact(variable, value, line.text()));
                }
            }
        }
    }

    private static GuardKind guardKind(ClassifiedLine line) {
        if (line.keyword() == null) return null;
        if (line.kind() != LineKind.CONTROL_OPEN && !line.keyword().equals("ELSIF")) return null;
        return GuardKind.valueOf(line.keyword());
    }

    /** Identifiers and string literal contents of a condition, operators removed. */
    static List<String> conditionVariables(String condition) {
        List<String> variables = new ArrayList<>();
        Matcher m = CONDITION_TOKEN.matcher(condition);
        while (m.find()) {
            String token = m.group(1) != null ? m.group(1)
                         : m.group(2) != null ? m.group(2)
                         : m.group(3);
            token = token.strip();
            if (token.isEmpty() || OPERATORS.contains(token.toUpperCase(Locale.ROOT))) continue;
            variables.add(token);
        }
        return variables;
    }

    static String stripQuotes(String value) {
        String v = value.strip();
        while (!v.isEmpty() && (v.charAt(0) == '"' || v.charAt(0) == '\'')) v = v.substring(1);
        while (!v.isEmpty() && (v.endsWith("\"") || v.endsWith("'"))) v = v.substring(0, v.length() - 1);
        return v;
    }

    /** {@code 'IDLE': STATE} and {@code 1..3: STEP} name the variable after the label. */
    static String stripCaseLabel(String target) {
        int colon = target.lastIndexOf(':');
        return colon >= 0 ? target.substring(colon + 1).strip() : target;
    }

    private static String stripIndex(String target) {
        int bracket = target.indexOf('[');
        return bracket > 0 ? target.substring(0, bracket).strip() : target;
    }

    public List<AssignmentFact> assignments() {
        return Collections.unmodifiableList(assignments);
    }

    public List<GuardFact> guards() {
        return Collections.unmodifiableList(guards);
    }

    public List<OutputFact> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    public boolean isEmpty() {
        return assignments.isEmpty() && guards.isEmpty();
    }
}
