package com.crossplc.analyzer.fsm;

import com.crossplc.analyzer.fsm.ControlFlowFacts.GuardFact;
import com.crossplc.analyzer.fsm.ControlFlowFacts.GuardKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlFlowFactsTest {

    @Test
    void guardsOfEveryKind() {
        ControlFlowFacts facts = ControlFlowFacts.of(String.join("\n",
            "IF A > 1 THEN",
            "ELSIF B THEN",
            "ELSE",
            "END_IF;",
            "CASE STEP OF",
            "END_CASE;",
            "WHILE RUN DO",
            "END_WHILE;",
            "FOR I := 1 TO N DO",
            "END_FOR;"));

        assertEquals(List.of(GuardKind.IF, GuardKind.ELSIF, GuardKind.CASE, GuardKind.WHILE, GuardKind.FOR),
            facts.guards().stream().map(GuardFact::kind).toList());
        assertEquals(List.of("I", "1", "N"), facts.guards().get(4).variables());
    }

    @Test
    void conditionVariablesDropOperatorsAndUnquoteStrings() {
        assertEquals(List.of("STATE", "IDLE", "START"),
            ControlFlowFacts.conditionVariables("STATE = \"IDLE\" AND NOT START"));
        assertEquals(List.of("MODE", "AUTO"), ControlFlowFacts.conditionVariables("MODE = 'AUTO'"));
    }

    @Test
    void assignmentsAndOutputs() {
        ControlFlowFacts facts = ControlFlowFacts.of("IF GO THEN PUMP := on; END_IF;\nSTEP := \"FILL\";\nLEVEL[2] := 5;");

        assertEquals(List.of("PUMP", "STEP", "LEVEL"),
            facts.assignments().stream().map(ControlFlowFacts.AssignmentFact::variable).toList());
        assertEquals("FILL", facts.assignments().get(1).value());
        assertEquals(1, facts.outputs().size());
        assertEquals("PUMP", facts.outputs().get(0).variable());
        assertEquals("IF GO THEN PUMP := on; END_IF;", facts.outputs().get(0).line());
    }

    @Test
    void emptyContent() {
        assertTrue(ControlFlowFacts.of(null).isEmpty());
        assertTrue(ControlFlowFacts.of("// nothing here").isEmpty());
    }

    @Test
    void caseLabelIsNotPartOfTheAssignedVariable() {
        ControlFlowFacts facts = ControlFlowFacts.of(String.join("\n",
            "CASE STEP OF",
            "    'IDLE': STEP := 'FILL';",
            "    10: STEP := 'DRAIN';",
            "    20..30: VALVE[2] := ON;",
            "END_CASE;"));

        assertEquals(List.of("STEP", "STEP", "VALVE"),
            facts.assignments().stream().map(ControlFlowFacts.AssignmentFact::variable).toList());
        assertEquals(List.of("FILL", "DRAIN", "ON"),
            facts.assignments().stream().map(ControlFlowFacts.AssignmentFact::value).toList());
        assertEquals("VALVE", facts.outputs().get(0).variable());
    }
}
