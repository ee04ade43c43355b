package com.crossplc.analyzer.fsm;

import com.crossplc.analyzer.config.FsmConfig;
import com.crossplc.analyzer.fsm.ControlFlowFacts.AssignmentFact;
import com.crossplc.analyzer.fsm.ControlFlowFacts.GuardFact;
import com.crossplc.analyzer.fsm.ControlFlowFacts.GuardKind;
import com.crossplc.analyzer.fsm.ControlFlowFacts.OutputFact;
import com.crossplc.analyzer.ir.IrModel.FsmState;
import com.crossplc.analyzer.ir.IrModel.FsmTransition;
import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrModel.IrStateMachine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers one state machine from the assignments and guards of a project.
 *
 * <p>The state variable is chosen by evidence score:
 * <ul>
 *   <li>+2 for every guard mentioning it</li>
 *   <li>+1 for every assignment to it</li>
 *   <li>+3 for every output-style assignment to it ({@code TRUE}, {@code ON}, {@code OPEN}, ...)</li>
 *   <li>+2 once if any value assigned to it is a state-like word ({@code idle}, {@code running}, ...)</li>
 * </ul>
 * A configured {@code state_var} wins when it scores at least {@value #MIN_HINT_SCORE};
 * otherwise the best positive candidate is taken, ties going to the one seen first.
 *
 * <p>Transition sources are not resolved: every transition starts from
 * {@link FsmTransition#UNKNOWN_STATE}, or {@link FsmTransition#CURRENT_STATE} when the
 * config asks for it.
 */
public class FsmExtractor {

    static final int MIN_HINT_SCORE = 3;

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final Pattern STATE_VALUE = Pattern.compile("^[A-Za-z0-9_]+$");

    private static final Set<String> LITERALS =
        Set.of("TRUE", "FALSE", "ON", "OFF", "OPEN", "CLOSE", "IDLE", "FAULT");
    private static final Set<String> STATE_LIKE_VALUES = Set.of(
        "idle", "fault", "running", "stopped", "error", "init",
        "fill", "drain", "heat", "cool", "open", "close", "on", "off");
    private static final Set<String> BOOLEAN_LIKE_VALUES = Set.of("true", "false", "1", "0", "on", "off");
    private static final Set<String> INITIAL_STATES = Set.of("idle", "init", "ready", "false", "0", "off");
    private static final Set<String> FINAL_STATES = Set.of("fault", "error", "stopped", "true", "1", "on");

    private final FsmConfig config;

    public FsmExtractor() {
        this(FsmConfig.empty());
    }

    public FsmExtractor(FsmConfig config) {
        this.config = config != null ? config : FsmConfig.empty();
    }

    public Optional<IrStateMachine> extractStateMachine(IrProject project) {
        return extract(project).stateMachine();
    }

    public FsmExtraction extract(IrProject project) {
        ControlFlowFacts facts = ControlFlowFacts.extract(project);
        Map<String, Integer> scores = scoreCandidates(facts);
        List<String> physicalVars = observedPhysicalVars(facts);

        String stateVar = identifyStateVariable(facts, scores);
        if (stateVar == null) {
            return FsmExtraction.none(scores, physicalVars);
        }

        List<FsmState> states = extractStates(facts, stateVar);
        if (states.isEmpty()) {
            return FsmExtraction.none(scores, physicalVars);
        }
        List<FsmTransition> transitions = extractTransitions(facts, stateVar);

        IrStateMachine fsm = new IrStateMachine();
        fsm.name = "FSM_" + stateVar;
        fsm.stateVariable = stateVar;
        fsm.description = "Extracted FSM for state variable " + stateVar;
        fsm.sourceType = project.controller != null ? project.controller.sourceType : null;
        fsm.states = states;
        fsm.transitions = transitions;
        fsm.isImplicit = isImplicit(facts, stateVar);

        return new FsmExtraction(fsm, validate(stateVar, states, transitions), scores, physicalVars);
    }

    String identifyStateVariable(ControlFlowFacts facts, Map<String, Integer> scores) {
        String hint = config.getStateVar();
        if (hint != null && !hint.isBlank() && score(facts, hint) >= MIN_HINT_SCORE) {
            return hint;
        }
        return scores.isEmpty() ? null : scores.keySet().iterator().next();
    }

    /** Positive-scoring candidates, best first; equal scores keep encounter order. */
    Map<String, Integer> scoreCandidates(ControlFlowFacts facts) {
        List<Map.Entry<String, Integer>> scored = new ArrayList<>();
        for (String candidate : candidates(facts)) {
            int score = score(facts, candidate);
            if (score > 0) {
                scored.add(Map.entry(candidate, score));
            }
        }
        // List.sort is stable
        scored.sort(Comparator.comparing((Map.Entry<String, Integer> e) -> e.getValue()).reversed());

        Map<String, Integer> ranked = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : scored) {
            ranked.put(e.getKey(), e.getValue());
        }
        return ranked;
    }

    private static Set<String> candidates(ControlFlowFacts facts) {
        Set<String> candidates = new LinkedHashSet<>();
        for (GuardFact guard : facts.guards()) {
            for (String variable : guard.variables()) {
                if (isCandidateName(variable)) candidates.add(variable);
            }
        }
        for (AssignmentFact assignment : facts.assignments()) {
            if (isCandidateName(assignment.variable())) candidates.add(assignment.variable());
        }
        for (OutputFact output : facts.outputs()) {
            if (isCandidateName(output.variable())) candidates.add(output.variable());
        }
        return candidates;
    }

    static boolean isCandidateName(String name) {
        return IDENTIFIER.matcher(name).matches() && !LITERALS.contains(name.toUpperCase(Locale.ROOT));
    }

    static int score(ControlFlowFacts facts, String candidate) {
        int score = 0;
        for (GuardFact guard : facts.guards()) {
            if (guard.mentions(candidate)) score += 2;
        }
        boolean stateLike = false;
        for (AssignmentFact assignment : facts.assignments()) {
            if (assignment.variable().equals(candidate)) {
                score += 1;
                stateLike |= STATE_LIKE_VALUES.contains(assignment.value().toLowerCase(Locale.ROOT));
            }
        }
        for (OutputFact output : facts.outputs()) {
            if (output.variable().equals(candidate)) score += 3;
        }
        return stateLike ? score + 2 : score;
    }

    List<FsmState> extractStates(ControlFlowFacts facts, String stateVar) {
        Set<String> names = new LinkedHashSet<>();
        for (AssignmentFact assignment : facts.assignments()) {
            if (assignment.variable().equals(stateVar) && isStateValue(assignment.value())) {
                names.add(assignment.value());
            }
        }
        for (GuardFact guard : facts.guards()) {
            if (!guard.mentions(stateVar)) continue;
            for (String variable : guard.variables()) {
                if (!variable.equals(stateVar) && isStateValue(variable)) {
                    names.add(variable);
                }
            }
        }
        names.addAll(config.getExplicitStates());

        List<FsmState> states = new ArrayList<>();
        for (String name : names) {
            FsmState state = new FsmState();
            state.name = name;
            state.description = "State: " + name;
            String lower = name.toLowerCase(Locale.ROOT);
            state.isInitial = INITIAL_STATES.contains(lower);
            state.isFinal = FINAL_STATES.contains(lower);
            states.add(state);
        }
        return states;
    }

    /** Every IF/ELSIF guard paired with every assignment to the state variable. */
    List<FsmTransition> extractTransitions(ControlFlowFacts facts, String stateVar) {
        String fromState = config.isRewriteUnknownSources()
            ? FsmTransition.CURRENT_STATE
            : FsmTransition.UNKNOWN_STATE;

        List<FsmTransition> transitions = new ArrayList<>();
        for (GuardFact guard : facts.guards()) {
            if (guard.kind() != GuardKind.IF && guard.kind() != GuardKind.ELSIF) continue;
            for (AssignmentFact assignment : facts.assignments()) {
                if (!assignment.variable().equals(stateVar) || !isStateValue(assignment.value())) continue;
                FsmTransition transition = new FsmTransition();
                transition.fromState = fromState;
                transition.toState = assignment.value();
                transition.guard = guard.line();
                transition.actions = new ArrayList<>(List.of(assignment.line()));
                transitions.add(transition);
            }
        }
        return transitions;
    }

    static boolean isImplicit(ControlFlowFacts facts, String stateVar) {
        for (AssignmentFact assignment : facts.assignments()) {
            if (assignment.variable().equals(stateVar)
                    && BOOLEAN_LIKE_VALUES.contains(assignment.value().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    static boolean isStateValue(String value) {
        return STATE_VALUE.matcher(value).matches() && !value.chars().allMatch(Character::isDigit);
    }

    FsmValidation validate(String stateVar, List<FsmState> states, List<FsmTransition> transitions) {
        List<String> expectedStates = config.getExpectedStates().get(stateVar);
        List<Map<String, String>> expectedTransitions = config.getExpectedTransitions().get(stateVar);
        if (expectedStates == null && expectedTransitions == null) {
            return FsmValidation.notChecked();
        }

        List<String> actual = new ArrayList<>();
        states.forEach(s -> actual.add(s.name));

        List<String> missingStates = new ArrayList<>();
        List<String> unexpectedStates = new ArrayList<>();
        if (expectedStates != null) {
            for (String expected : expectedStates) {
                if (!actual.contains(expected)) missingStates.add(expected);
            }
            for (String name : actual) {
                if (!expectedStates.contains(name)) unexpectedStates.add(name);
            }
        }

        List<String> missingTransitions = new ArrayList<>();
        if (expectedTransitions != null) {
            for (Map<String, String> descriptor : expectedTransitions) {
                String to = descriptor.get("to");
                String from = descriptor.get("from");
                if (to == null) continue;
                boolean found = transitions.stream().anyMatch(t ->
                    to.equals(t.toState) && (from == null || from.equals(t.fromState)));
                if (!found) {
                    missingTransitions.add((from != null ? from : "*") + " -> " + to);
                }
            }
        }

        boolean valid = missingStates.isEmpty() && missingTransitions.isEmpty();
        return new FsmValidation(valid, missingStates, unexpectedStates, missingTransitions);
    }

    private List<String> observedPhysicalVars(ControlFlowFacts facts) {
        List<String> observed = new ArrayList<>();
        for (String variable : config.getPhysicalVars()) {
            boolean seen = facts.assignments().stream().anyMatch(a -> a.variable().equals(variable))
                || facts.guards().stream().anyMatch(g -> g.mentions(variable));
            if (seen) observed.add(variable);
        }
        return observed;
    }
}
