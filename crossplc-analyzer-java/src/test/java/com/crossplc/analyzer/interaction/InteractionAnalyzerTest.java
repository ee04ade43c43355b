package com.crossplc.analyzer.interaction;

import com.crossplc.analyzer.ir.IrModel.IrProgram;
import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrModel.TagScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.crossplc.analyzer.IrFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class InteractionAnalyzerTest {

    private IrProject project;

    @BeforeEach
    void setUp() {
        IrProgram producer = program("Producer", routine("Produce", "LOCAL_A := SPEED;"));
        producer.tags.add(tag("LOCAL_A", "DINT", TagScope.PROGRAM));
        IrProgram consumer = program("Consumer", routine("Consume", "IF local_a THEN SPEED := 0; END_IF;"));
        IrProgram idle = program("Idle", routine("Nothing", "X := 1;"));
        project = project("C1", List.of(tag("SPEED", "REAL")), producer, consumer, idle);
    }

    @Test
    void programTagsIncludeDeclaredAndMentionedTags() {
        InteractionReport report = new InteractionAnalyzer().analyze(project);
        assertEquals(Set.of("LOCAL_A", "SPEED"), report.programTags().get("Producer"));
        assertEquals(Set.of("LOCAL_A", "SPEED"), report.programTags().get("Consumer"));
        assertTrue(report.programTags().get("Idle").isEmpty());
        assertEquals(Set.of("Producer", "Consumer"), report.tagReferences().get("SPEED"));
    }

    @Test
    void crossProgramInteractionPerOrderedPair() {
        List<Interaction> cross = new InteractionAnalyzer().analyze(project).ofType(Interaction.Type.CROSS_PROGRAM);
        assertEquals(2, cross.size());
        Interaction first = cross.get(0);
        assertEquals("C1.Producer", first.source());
        assertEquals("C1.Consumer", first.target());
        assertEquals(Set.of("LOCAL_A", "SPEED"), Set.copyOf(first.via()));
        assertEquals("C1.Consumer", cross.get(1).source());
        assertEquals("C1.Producer", cross.get(1).target());
    }

    @Test
    void programToControllerInteractions() {
        List<Interaction> toController =
            new InteractionAnalyzer().analyze(project).ofType(Interaction.Type.PROGRAM_TO_CONTROLLER);
        assertEquals(2, toController.size());
        for (Interaction i : toController) {
            assertEquals("C1", i.target());
            assertEquals(List.of("SPEED"), i.via());
        }
    }

    @Test
    void mentionIsSubstringContainment() {
        IrProject p = project("C", List.of(tag("PUMP", "BOOL")),
            program("A", routine("R", "PUMP_SPEED := 1;")));
        InteractionReport report = new InteractionAnalyzer().analyze(p);
        assertEquals(Set.of("PUMP"), report.programTags().get("A"));
    }

    @Test
    void summaryCountsByType() {
        InteractionReport.Summary summary = new InteractionAnalyzer().analyze(project).summary();
        assertEquals(4, summary.total());
        assertEquals(2, summary.crossProgram());
        assertEquals(2, summary.programToController());
    }
}
