package com.crossplc.analyzer.export;

import com.crossplc.analyzer.cfg.BasicBlock;
import com.crossplc.analyzer.cfg.RoutineCfg;
import com.crossplc.analyzer.dataflow.DataFlowEdge;
import com.crossplc.analyzer.export.AnalysisSerializer.SerializerException;
import com.crossplc.analyzer.ir.IrModel.FsmState;
import com.crossplc.analyzer.ir.IrModel.FsmTransition;
import com.crossplc.analyzer.ir.IrModel.IrStateMachine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renders control-flow and inter-routine data-flow graphs as Graphviz DOT and GraphML, and an
 * extracted state machine as DOT.
 *
 * CFG node ids are {@code routine:block_id}, since block ids are only unique per session
 * and successors of an IF block may name ids that were never allocated. Such dangling
 * successors are left out.
 */
public class GraphExporter {

    public static final String CFG_DOT = "cfg.dot";
    public static final String CFG_GRAPHML = "cfg.graphml";
    public static final String DATAFLOW_DOT = "dataflow.dot";
    public static final String DATAFLOW_GRAPHML = "dataflow.graphml";
    public static final String FSM_DOT = "fsm.dot";

    static final int MAX_GUARD_LABEL = 30;

    private static final String GRAPHML_HEADER =
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
        + "<graphml xmlns=\"http://graphml.graphdrawing.org/xmlns\">\n"
        + "  <key id=\"label\" for=\"node\" attr.name=\"label\" attr.type=\"string\"/>\n"
        + "  <key id=\"kind\" for=\"node\" attr.name=\"kind\" attr.type=\"string\"/>\n"
        + "  <key id=\"tag\" for=\"edge\" attr.name=\"tag\" attr.type=\"string\"/>\n";

    public String cfgToDot(Map<String, RoutineCfg> cfgs) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ControlFlow {\n");
        sb.append("  node [shape=box, fontsize=10];\n");

        int cluster = 0;
        for (RoutineCfg cfg : cfgs.values()) {
            sb.append("  subgraph cluster_").append(cluster++).append(" {\n");
            sb.append("    label=\"").append(escapeDot(cfg.routineName())).append("\";\n");
            for (BasicBlock block : cfg.blocks()) {
                sb.append("    \"").append(escapeDot(nodeId(cfg, block.id))).append("\"")
                  .append(" [label=\"").append(escapeDot(blockLabel(block))).append("\"")
                  .append(block.isControl() ? ", shape=diamond" : "")
                  .append("];\n");
            }
            for (BasicBlock block : cfg.blocks()) {
                for (String successor : localSuccessors(cfg, block)) {
                    sb.append("    \"").append(escapeDot(nodeId(cfg, block.id))).append("\" -> \"")
                      .append(escapeDot(nodeId(cfg, successor))).append("\"")
                      .append(edgeLabel(block, successor))
                      .append(";\n");
                }
            }
            sb.append("  }\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    public String dataFlowToDot(List<DataFlowEdge> edges) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph DataFlow {\n");
        sb.append("  rankdir=LR;\n");
        sb.append("  node [shape=box, fontsize=10];\n");
        for (String routine : routinesOf(edges)) {
            sb.append("  \"").append(escapeDot(routine)).append("\";\n");
        }
        for (DataFlowEdge edge : edges) {
            sb.append("  \"").append(escapeDot(edge.sourceRoutine())).append("\" -> \"")
              .append(escapeDot(edge.targetRoutine())).append("\"")
              .append(" [label=\"").append(escapeDot(edge.tag())).append("\"];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Final states are double circles, initial states are bold. Transition sources that are
     * not states ({@code UNKNOWN}, {@code CURRENT_STATE}) get a dashed node. Edges are
     * labeled with the guard, quotes removed and cut to {@value #MAX_GUARD_LABEL} characters.
     */
    public String fsmToDot(IrStateMachine fsm) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph FSM {\n");
        sb.append("  rankdir=LR;\n");
        sb.append("  label=\"").append(escapeDot(fsm.name != null ? fsm.name : "")).append("\";\n");
        sb.append("  node [shape=circle];\n");

        Set<String> nodes = new LinkedHashSet<>();
        for (FsmState state : fsm.states) {
            nodes.add(state.name);
            sb.append("  \"").append(escapeDot(state.name)).append("\"")
              .append(" [shape=").append(state.isFinal ? "doublecircle" : "circle")
              .append(", style=").append(state.isInitial ? "bold" : "solid")
              .append("];\n");
        }
        for (FsmTransition transition : fsm.transitions) {
            for (String name : Arrays.asList(transition.fromState, transition.toState)) {
                if (name != null && nodes.add(name)) {
                    sb.append("  \"").append(escapeDot(name)).append("\" [style=dashed];\n");
                }
            }
        }
        for (FsmTransition transition : fsm.transitions) {
            if (transition.fromState == null || transition.toState == null) continue;
            sb.append("  \"").append(escapeDot(transition.fromState)).append("\" -> \"")
              .append(escapeDot(transition.toState)).append("\"")
              .append(" [label=\"").append(escapeDot(guardLabel(transition.guard))).append("\"];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    public String cfgToGraphMl(Map<String, RoutineCfg> cfgs) {
        StringBuilder sb = new StringBuilder(GRAPHML_HEADER);
        sb.append("  <graph id=\"ControlFlow\" edgedefault=\"directed\">\n");
        int edgeIndex = 0;
        for (RoutineCfg cfg : cfgs.values()) {
            for (BasicBlock block : cfg.blocks()) {
                sb.append("    <node id=\"").append(escapeXml(nodeId(cfg, block.id))).append("\">\n")
                  .append("      <data key=\"label\">").append(escapeXml(blockLabel(block))).append("</data>\n")
                  .append("      <data key=\"kind\">").append(block.kind.name().toLowerCase(Locale.ROOT)).append("</data>\n")
                  .append("    </node>\n");
            }
            for (BasicBlock block : cfg.blocks()) {
                for (String successor : localSuccessors(cfg, block)) {
                    sb.append("    <edge id=\"e").append(edgeIndex++).append("\" source=\"")
                      .append(escapeXml(nodeId(cfg, block.id))).append("\" target=\"")
                      .append(escapeXml(nodeId(cfg, successor))).append("\"/>\n");
                }
            }
        }
        sb.append("  </graph>\n</graphml>\n");
        return sb.toString();
    }

    public String dataFlowToGraphMl(List<DataFlowEdge> edges) {
        StringBuilder sb = new StringBuilder(GRAPHML_HEADER);
        sb.append("  <graph id=\"DataFlow\" edgedefault=\"directed\">\n");
        for (String routine : routinesOf(edges)) {
            sb.append("    <node id=\"").append(escapeXml(routine)).append("\">\n")
              .append("      <data key=\"label\">").append(escapeXml(routine)).append("</data>\n")
              .append("    </node>\n");
        }
        int edgeIndex = 0;
        for (DataFlowEdge edge : edges) {
            sb.append("    <edge id=\"e").append(edgeIndex++).append("\" source=\"")
              .append(escapeXml(edge.sourceRoutine())).append("\" target=\"")
              .append(escapeXml(edge.targetRoutine())).append("\">\n")
              .append("      <data key=\"tag\">").append(escapeXml(edge.tag())).append("</data>\n")
              .append("    </edge>\n");
        }
        sb.append("  </graph>\n</graphml>\n");
        return sb.toString();
    }

    /** Writes the four graph files into {@code outputDir}. */
    public void write(Map<String, RoutineCfg> cfgs, List<DataFlowEdge> edges, Path outputDir) {
        AnalysisSerializer.createDirectories(outputDir);
        writeFile(outputDir.resolve(CFG_DOT), cfgToDot(cfgs));
        writeFile(outputDir.resolve(CFG_GRAPHML), cfgToGraphMl(cfgs));
        writeFile(outputDir.resolve(DATAFLOW_DOT), dataFlowToDot(edges));
        writeFile(outputDir.resolve(DATAFLOW_GRAPHML), dataFlowToGraphMl(edges));
    }

    /** Writes {@link #FSM_DOT} into {@code outputDir}. */
    public void writeFsm(IrStateMachine fsm, Path outputDir) {
        AnalysisSerializer.createDirectories(outputDir);
        writeFile(outputDir.resolve(FSM_DOT), fsmToDot(fsm));
    }

    private static void writeFile(Path path, String content) {
        try {
            Files.writeString(path, content);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static String nodeId(RoutineCfg cfg, String blockId) {
        return cfg.routineName() + ":" + blockId;
    }

    private static Set<String> localSuccessors(RoutineCfg cfg, BasicBlock block) {
        Set<String> known = new HashSet<>();
        cfg.blocks().forEach(b -> known.add(b.id));
        Set<String> successors = new LinkedHashSet<>(block.successors);
        successors.retainAll(known);
        return successors;
    }

    private static String blockLabel(BasicBlock block) {
        StringBuilder label = new StringBuilder(block.id);
        if (block.condition != null) {
            label.append("\n").append(block.condition);
        }
        for (String instruction : block.instructions) {
            label.append("\n").append(instruction);
        }
        return label.toString();
    }

    private static String edgeLabel(BasicBlock block, String successor) {
        if (successor.equals(block.trueSuccessor)) return " [label=\"true\"]";
        if (successor.equals(block.falseSuccessor)) return " [label=\"false\"]";
        return "";
    }

    static String guardLabel(String guard) {
        if (guard == null) return "";
        String label = guard.replace("\"", "").replace("'", "");
        return label.length() > MAX_GUARD_LABEL ? label.substring(0, MAX_GUARD_LABEL - 3) + "..." : label;
    }

    private static Set<String> routinesOf(List<DataFlowEdge> edges) {
        Set<String> routines = new LinkedHashSet<>();
        for (DataFlowEdge edge : edges) {
            routines.add(edge.sourceRoutine());
            routines.add(edge.targetRoutine());
        }
        return routines;
    }

    static String escapeDot(String raw) {
        return raw.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    static String escapeXml(String raw) {
        return raw.replace("&", "&amp;")
                  .replace("<", "&lt;")
                  .replace(">", "&gt;")
                  .replace("\"", "&quot;")
                  .replace("'", "&apos;");
    }
}
