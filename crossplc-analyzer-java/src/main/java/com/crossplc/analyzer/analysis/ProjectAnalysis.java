package com.crossplc.analyzer.analysis;

import com.crossplc.analyzer.cfg.RoutineCfg;
import com.crossplc.analyzer.dataflow.DataFlowEdge;
import com.crossplc.analyzer.dataflow.RoutineDataFlow;
import com.crossplc.analyzer.fsm.FsmExtraction;
import com.crossplc.analyzer.interaction.InteractionReport;
import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * Aggregate result of analyzing one controller project.
 */
public record ProjectAnalysis(
    @SerializedName("controller")          String controller,
    @SerializedName("validation_errors")   List<String> validationErrors,
    @SerializedName("control_flow")        Map<String, RoutineCfg> cfgs,
    @SerializedName("data_flow")           Map<String, RoutineDataFlow> dataFlow,
    @SerializedName("inter_routine_flow")  List<DataFlowEdge> interRoutineEdges,
    @SerializedName("interactions")        InteractionReport interactions,
    @SerializedName("fsm")                 FsmExtraction fsm
) {
    public boolean isValid() {
        return validationErrors.isEmpty();
    }
}
