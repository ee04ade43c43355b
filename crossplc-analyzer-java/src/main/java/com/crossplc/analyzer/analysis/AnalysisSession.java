package com.crossplc.analyzer.analysis;

import com.crossplc.analyzer.cfg.CfgBuilder;
import com.crossplc.analyzer.cfg.RoutineCfg;
import com.crossplc.analyzer.config.FsmConfig;
import com.crossplc.analyzer.dataflow.DataFlowAnalyzer;
import com.crossplc.analyzer.dataflow.DataFlowEdge;
import com.crossplc.analyzer.dataflow.RoutineDataFlow;
import com.crossplc.analyzer.fsm.CrossControllerFsm;
import com.crossplc.analyzer.fsm.CrossControllerFsmExtractor;
import com.crossplc.analyzer.fsm.FsmExtraction;
import com.crossplc.analyzer.fsm.FsmExtractor;
import com.crossplc.analyzer.interaction.InteractionAnalyzer;
import com.crossplc.analyzer.interaction.InteractionReport;
import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrValidator;
import com.crossplc.analyzer.multi_plc.ConflictingTag;
import com.crossplc.analyzer.multi_plc.CrossPlcDependency;
import com.crossplc.analyzer.multi_plc.MultiPlcAnalyzer;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Runs the analysis passes in order over already loaded IR.
 *
 * One session owns one {@link CfgBuilder}, so block ids keep counting across every
 * project analyzed by the same session. Use a new session for independent runs.
 */
public class AnalysisSession {

    private final CfgBuilder cfgBuilder = new CfgBuilder();
    private final DataFlowAnalyzer dataFlowAnalyzer = new DataFlowAnalyzer();
    private final InteractionAnalyzer interactionAnalyzer = new InteractionAnalyzer();

    public ProjectAnalysis analyzeProject(IrProject project) {
        return analyzeProject(project, FsmConfig.empty());
    }

    public ProjectAnalysis analyzeProject(IrProject project, FsmConfig fsmConfig) {
        List<String> errors = IrValidator.validate(project);
        for (String error : errors) {
            System.err.println("[crossplc] WARNING: " + error);
        }

        Map<String, RoutineCfg> cfgs = cfgBuilder.buildAll(project);
        int blocks = cfgs.values().stream().mapToInt(c -> c.blocks().size()).sum();
        System.err.println("[crossplc] Control flow: " + cfgs.size() + " routines, " + blocks + " blocks");

        Map<String, RoutineDataFlow> flows = dataFlowAnalyzer.analyzeAll(cfgs);
        List<DataFlowEdge> edges = dataFlowAnalyzer.interRoutineDataFlow(flows);
        System.err.println("[crossplc] Data flow: " + edges.size() + " inter-routine edges");

        InteractionReport interactions = interactionAnalyzer.analyze(project);
        System.err.println("[crossplc] Interactions: " + interactions.interactions().size());

        FsmExtraction fsm = new FsmExtractor(fsmConfig).extract(project);
        System.err.println("[crossplc] FSM: " + fsm.stateMachine()
                .map(m -> m.name + " (" + m.states.size() + " states, " + m.transitions.size() + " transitions)")
                .orElse("none identified"));

        return new ProjectAnalysis(project.controllerName(), errors, cfgs, flows, edges, interactions, fsm);
    }

    public MultiPlcReport analyzePlcs(Map<String, IrProject> plcs) {
        return analyzePlcs(plcs, false, name -> FsmConfig.empty());
    }

    /**
     * Cross-PLC dependencies and conflicts, plus the composite FSM. Each discovered FSM is
     * attached to its controller.
     */
    public MultiPlcReport analyzePlcs(Map<String, IrProject> plcs, boolean parallelScan,
                                      Function<String, FsmConfig> fsmConfigs) {
        MultiPlcAnalyzer analyzer = new MultiPlcAnalyzer(plcs, parallelScan);
        List<CrossPlcDependency> dependencies = analyzer.findCrossPlcDependencies();
        List<ConflictingTag> conflicts = analyzer.detectConflictingTags();
        System.err.println("[crossplc] Multi-PLC: " + plcs.size() + " PLCs, "
                + dependencies.size() + " dependencies, " + conflicts.size() + " conflicts");

        CrossControllerFsmExtractor fsmExtractor = new CrossControllerFsmExtractor(fsmConfigs);
        CrossControllerFsm composite = fsmExtractor.extract(plcs);
        fsmExtractor.attachStateMachines(plcs, composite);

        return new MultiPlcReport(analyzer.summary(dependencies, conflicts), dependencies, conflicts, composite);
    }

    public CfgBuilder cfgBuilder() {
        return cfgBuilder;
    }
}
