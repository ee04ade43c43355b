package com.crossplc.analyzer.dataflow;

import com.crossplc.analyzer.cfg.BasicBlock;
import com.crossplc.analyzer.cfg.RoutineCfg;
import com.crossplc.analyzer.text.LineClassifier;
import com.crossplc.analyzer.text.LineClassifier.Assignment;
import com.crossplc.analyzer.text.LineClassifier.ClassifiedLine;
import com.crossplc.analyzer.text.TagExtractor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes def/use sets over routine CFGs and the write-to-read relation between routines.
 */
public class DataFlowAnalyzer {

    public Map<String, RoutineDataFlow> analyzeAll(Map<String, RoutineCfg> cfgs) {
        Map<String, RoutineDataFlow> flows = new LinkedHashMap<>();
        for (Map.Entry<String, RoutineCfg> entry : cfgs.entrySet()) {
            flows.put(entry.getKey(), analyze(entry.getValue()));
        }
        return flows;
    }

    public RoutineDataFlow analyze(RoutineCfg cfg) {
        Map<String, DefUse> blocks = new LinkedHashMap<>();
        DefUse routine = new DefUse();
        for (BasicBlock block : cfg.blocks()) {
            DefUse du = defUseOf(block);
            blocks.put(block.id, du);
            routine.addAll(du);
        }
        return new RoutineDataFlow(cfg.routineName(), blocks, routine);
    }

    /**
     * Each assignment contributes the first tag of its left side to defs and every tag of
     * its right side to uses. A control block's condition and the guard of an ELSIF line
     * held inside the block only contribute uses.
     */
    public static DefUse defUseOf(BasicBlock block) {
        DefUse du = new DefUse();
        for (String instruction : block.instructions) {
            ClassifiedLine line = LineClassifier.classify(instruction);
            if ("ELSIF".equals(line.keyword()) && line.hasCondition()) {
                du.uses.addAll(TagExtractor.extractTags(line.condition()));
            }
            for (Assignment assignment : line.assignments()) {
                String target = TagExtractor.extractTag(assignment.target());
                if (target != null) {
                    du.defs.add(target);
                }
                du.uses.addAll(TagExtractor.extractTags(assignment.value()));
            }
        }
        if (block.isControl() && block.condition != null) {
            du.uses.addAll(TagExtractor.extractTags(block.condition));
        }
        return du;
    }

    /**
     * One edge per (writer routine, reader routine, tag) over every ordered pair of distinct
     * routines. Quadratic in the routine count.
     */
    public List<DataFlowEdge> interRoutineDataFlow(Map<String, RoutineDataFlow> flows) {
        List<DataFlowEdge> edges = new ArrayList<>();
        for (RoutineDataFlow source : flows.values()) {
            for (RoutineDataFlow target : flows.values()) {
                if (Objects.equals(source.routineName(), target.routineName())) continue;
                for (String tag : source.routine().defs) {
                    if (target.routine().uses.contains(tag)) {
                        edges.add(DataFlowEdge.writeToRead(source.routineName(), target.routineName(), tag));
                    }
                }
            }
        }
        return edges;
    }
}
