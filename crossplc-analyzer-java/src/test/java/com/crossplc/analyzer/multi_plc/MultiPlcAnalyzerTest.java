package com.crossplc.analyzer.multi_plc;

import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrModel.TagScope;
import com.crossplc.analyzer.multi_plc.ConflictingTag.ConflictKind;
import com.crossplc.analyzer.multi_plc.MultiPlcAnalyzer.MultiPlcSummary;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.crossplc.analyzer.IrFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MultiPlcAnalyzerTest {

    private static Map<String, IrProject> plcs(String n1, IrProject p1, String n2, IrProject p2) {
        Map<String, IrProject> map = new LinkedHashMap<>();
        map.put(n1, p1);
        map.put(n2, p2);
        return map;
    }

    @Test
    void sameDeclarationWithoutUseIsNeitherConflictNorDependency() {
        IrProject p1 = project("C1", List.of(tag("ALARM", "BOOL"), tag("Status_Word", "DINT")),
            program("Main", routine("R", "Status_Word := 0;")));
        IrProject p2 = project("C2", List.of(tag("ALARM", "BOOL")),
            program("Main", routine("R", "HORN := SIREN;")));

        MultiPlcAnalyzer analyzer = new MultiPlcAnalyzer(plcs("P1", p1, "P2", p2));
        assertTrue(analyzer.detectConflictingTags().isEmpty());
        assertTrue(analyzer.findCrossPlcDependencies().isEmpty());
    }

    @Test
    void writeInOnePlcAndReadInAnotherIsADependency() {
        IrProject p1 = project("C1", List.of(tag("ALARM", "BOOL")),
            program("Main", routine("Detect", "ALARM := OVERHEAT;")));
        IrProject p2 = project("C2", List.of(tag("ALARM", "BOOL")),
            program("Main", routine("Horn", "IF ALARM THEN\nHORN := TRUE;\nEND_IF;")));

        List<CrossPlcDependency> deps = new MultiPlcAnalyzer(plcs("P1", p1, "P2", p2)).findCrossPlcDependencies();
        assertEquals(1, deps.size());
        CrossPlcDependency dep = deps.get(0);
        assertEquals("ALARM", dep.tag());
        assertEquals("P1", dep.writer());
        assertEquals(List.of("P2"), dep.readers());
        assertEquals("BOOL", dep.dataType());
    }

    @Test
    void oneDependencyPerWriterAndReaderPair() {
        IrProject w1 = project("W1", List.of(), program("M", routine("R", "SETPOINT := 10;")));
        IrProject w2 = project("W2", List.of(), program("M", routine("R", "SETPOINT := 20;")));
        IrProject r = project("R", List.of(), program("M", routine("R", "OUT := SETPOINT;")));
        Map<String, IrProject> map = new LinkedHashMap<>();
        map.put("W1", w1);
        map.put("W2", w2);
        map.put("R", r);

        List<CrossPlcDependency> deps = new MultiPlcAnalyzer(map).findCrossPlcDependencies();
        assertEquals(2, deps.size());
        assertEquals(Set.of("W1", "W2"), deps.stream().map(CrossPlcDependency::writer).collect(Collectors.toSet()));
        assertTrue(deps.stream().allMatch(d -> d.readers().equals(List.of("R"))));
        assertNull(deps.get(0).dataType());
    }

    @Test
    void conflictsAreSymmetric() {
        IrProject a = project("A", List.of(tag("ALARM", "BOOL")));
        IrProject b = project("B", List.of(tag("ALARM", "DINT")));

        List<ConflictingTag> forward = new MultiPlcAnalyzer(plcs("A", a, "B", b)).detectConflictingTags();
        List<ConflictingTag> backward = new MultiPlcAnalyzer(plcs("B", b, "A", a)).detectConflictingTags();

        assertEquals(1, forward.size());
        assertEquals(1, backward.size());
        assertEquals(ConflictKind.DIFFERENT_DATA_TYPES, forward.get(0).kind());
        assertEquals(ConflictKind.DIFFERENT_DATA_TYPES, backward.get(0).kind());
        assertEquals(new HashSet<>(forward.get(0).plcs()), new HashSet<>(backward.get(0).plcs()));
        assertEquals(forward.get(0).details(), backward.get(0).details());
        assertEquals(Map.of("A", "BOOL", "B", "DINT"), forward.get(0).details());
    }

    @Test
    void typeAndScopeConflictsAreReportedSeparately() {
        IrProject a = project("A", List.of(tag("LEVEL", "REAL", TagScope.CONTROLLER)));
        IrProject b = project("B", List.of(tag("LEVEL", "DINT", TagScope.PROGRAM)));

        List<ConflictingTag> conflicts = new MultiPlcAnalyzer(plcs("A", a, "B", b)).detectConflictingTags();
        assertEquals(Set.of(ConflictKind.DIFFERENT_DATA_TYPES, ConflictKind.DIFFERENT_SCOPES),
            conflicts.stream().map(ConflictingTag::kind).collect(Collectors.toSet()));
        ConflictingTag scope = conflicts.stream()
            .filter(c -> c.kind() == ConflictKind.DIFFERENT_SCOPES).findFirst().orElseThrow();
        assertEquals(Map.of("A", "controller", "B", "program"), scope.details());
    }

    @Test
    void parallelScanGivesTheSameResult() {
        Map<String, IrProject> map = new LinkedHashMap<>();
        for (int i = 0; i < 6; i++) {
            String content = "SHARED_" + i + " := LOCAL;\nOUT := SHARED_" + ((i + 1) % 6) + ";";
            map.put("PLC" + i, project("C" + i, List.of(tag("SHARED_" + i, i % 2 == 0 ? "BOOL" : "INT")),
                program("Main", routine("R" + i, content))));
        }
        MultiPlcAnalyzer sequential = new MultiPlcAnalyzer(map, false);
        MultiPlcAnalyzer parallel = new MultiPlcAnalyzer(map, true);

        assertEquals(sequential.findCrossPlcDependencies(), parallel.findCrossPlcDependencies());
        assertEquals(sequential.detectConflictingTags(), parallel.detectConflictingTags());
        assertEquals(6, sequential.findCrossPlcDependencies().size());
    }

    @Test
    void writersReadersAndSharedTags() {
        IrProject p1 = project("C1", List.of(), program("Main", routine("Cmd", "REMOTE_START := START_PB;")));
        IrProject p2 = project("C2", List.of(), program("Main", routine("Run", "IF REMOTE_START THEN\nRUN := 1;\nEND_IF;")));
        MultiPlcAnalyzer analyzer = new MultiPlcAnalyzer(plcs("P1", p1, "P2", p2));

        assertEquals(Map.of("P1", List.of("Cmd")), analyzer.writersOf("REMOTE_START"));
        assertEquals(Map.of("P2", List.of("Run")), analyzer.readersOf("REMOTE_START"));
        assertEquals(Map.of("P1", List.of("Cmd")), analyzer.readersOf("START_PB"));
        assertTrue(analyzer.writersOf("UNKNOWN").isEmpty());
        assertEquals(Set.of("REMOTE_START"), analyzer.sharedTags());
    }

    @Test
    void summaryCountsPerPlc() {
        IrProject p1 = project("C1", List.of(tag("A", "BOOL"), tag("B", "BOOL")),
            program("M1", routine("R1", "A := B;")), program("M2", routine("R2", "B := 1;")));
        IrProject p2 = project("C2", List.of(tag("A", "INT")), program("M", routine("R", "X := A;")));

        MultiPlcSummary summary = new MultiPlcAnalyzer(plcs("P1", p1, "P2", p2)).summary();
        assertEquals(2, summary.totalPlcs());
        assertEquals(List.of("P1", "P2"), summary.plcNames());
        assertEquals(1, summary.totalDependencies());
        assertEquals(1, summary.totalConflicts());
        assertEquals(2, summary.plcSummary().get("P1").programs());
        assertEquals(2, summary.plcSummary().get("P1").routines());
        assertEquals(2, summary.plcSummary().get("P1").controllerTags());
        assertEquals("L5X", summary.plcSummary().get("P2").source());
    }
}
