package com.crossplc.analyzer.dataflow;

import com.crossplc.analyzer.cfg.CfgBuilder;
import com.crossplc.analyzer.cfg.RoutineCfg;
import com.crossplc.analyzer.ir.IrModel.IrProject;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.crossplc.analyzer.IrFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DataFlowAnalyzerTest {

    private final DataFlowAnalyzer analyzer = new DataFlowAnalyzer();

    private RoutineDataFlow flowOf(String content) {
        RoutineCfg cfg = new CfgBuilder().build(routine("R", content)).orElseThrow();
        return analyzer.analyze(cfg);
    }

    @Test
    void singleBlockRoutineEqualsItsBlock() {
        RoutineDataFlow flow = flowOf("A := B + C;\nD := A;");
        DefUse entry = flow.block(CfgBuilder.ENTRY);

        assertEquals(Set.of("A", "D"), entry.defs);
        assertEquals(Set.of("B", "C", "A"), entry.uses);
        assertEquals(entry.defs, flow.routine().defs);
        assertEquals(entry.uses, flow.routine().uses);
    }

    @Test
    void conditionOnlyContributesUses() {
        RoutineDataFlow flow = flowOf("IF START AND NOT STOP THEN\nMOTOR := TRUE;\nEND_IF;");
        DefUse branch = flow.block("block_1");
        assertEquals(Set.of("MOTOR"), branch.defs);
        assertEquals(Set.of("START", "STOP"), branch.uses);
    }

    @Test
    void arrayReferenceCountsAsItsBase() {
        RoutineDataFlow flow = flowOf("ARR[I] := VAL;\nOUT := ARR[2];");
        assertEquals(Set.of("ARR", "OUT"), flow.routine().defs);
        assertEquals(Set.of("VAL", "ARR"), flow.routine().uses);
    }

    @Test
    void emptyBlocksHaveEmptySets() {
        RoutineDataFlow flow = flowOf("IF A THEN\nB := 1;\nEND_IF;");
        assertTrue(flow.block(CfgBuilder.ENTRY).isEmpty());
        assertTrue(flow.block("block_2").isEmpty());
    }

    @Test
    void interRoutineEdgesCoverEveryWriterReaderPair() {
        IrProject project = project("C", List.of(), program("P",
            routine("R1", "X := 1;"),
            routine("R2", "Y := X;"),
            routine("R3", "X := Y;")));
        Map<String, RoutineDataFlow> flows = analyzer.analyzeAll(new CfgBuilder().buildAll(project));

        List<DataFlowEdge> edges = analyzer.interRoutineDataFlow(flows);
        assertEquals(Set.of(
            DataFlowEdge.writeToRead("R1", "R2", "X"),
            DataFlowEdge.writeToRead("R3", "R2", "X"),
            DataFlowEdge.writeToRead("R2", "R3", "Y")), new HashSet<>(edges));
        assertEquals(3, edges.size());
        assertTrue(edges.stream().allMatch(e -> DataFlowEdge.WRITE_TO_READ.equals(e.type())));
    }

    @Test
    void routineReadingItsOwnWriteIsNotAnEdge() {
        IrProject project = singleRoutine("C", "X := X + 1;");
        Map<String, RoutineDataFlow> flows = analyzer.analyzeAll(new CfgBuilder().buildAll(project));
        assertTrue(analyzer.interRoutineDataFlow(flows).isEmpty());
    }

    @Test
    void elsifGuardContributesUsesAndLinksRoutines() {
        IrProject project = project("C", List.of(), program("P",
            routine("W", "B := 1;"),
            routine("R", "IF A THEN\nX := 1;\nELSIF B THEN\nX := 2;\nEND_IF;")));
        Map<String, RoutineDataFlow> flows = analyzer.analyzeAll(new CfgBuilder().buildAll(project));

        assertEquals(Set.of("A", "B"), flows.get("R").routine().uses);
        assertEquals(Set.of("X"), flows.get("R").routine().defs);
        assertEquals(List.of(DataFlowEdge.writeToRead("W", "R", "B")),
            analyzer.interRoutineDataFlow(flows));
    }

    @Test
    void routinesWithoutNameAreComparedSafely() {
        RoutineCfg unnamed = new CfgBuilder().build(routine(null, "X := 1;")).orElseThrow();
        RoutineCfg reader = new CfgBuilder().build(routine("R", "Y := X;")).orElseThrow();
        Map<String, RoutineDataFlow> flows = new LinkedHashMap<>();
        flows.put("first", analyzer.analyze(unnamed));
        flows.put("second", analyzer.analyze(reader));

        assertEquals(List.of(DataFlowEdge.writeToRead(null, "R", "X")),
            analyzer.interRoutineDataFlow(flows));
    }
}
