package com.crossplc.analyzer.fsm;

import com.crossplc.analyzer.ir.IrModel.IrStateMachine;
import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one extraction run found. {@code fsm} is null when no state variable had
 * enough evidence or no states were found; the candidate scores are reported either way.
 */
public record FsmExtraction(
    @SerializedName("state_machine")    IrStateMachine fsm,
    @SerializedName("validation")       FsmValidation validation,
    @SerializedName("candidate_scores") Map<String, Integer> candidateScores,
    @SerializedName("physical_vars")    List<String> physicalVars
) {
    public Optional<IrStateMachine> stateMachine() {
        return Optional.ofNullable(fsm);
    }

    static FsmExtraction none(Map<String, Integer> candidateScores, List<String> physicalVars) {
        return new FsmExtraction(null, FsmValidation.notChecked(), candidateScores, physicalVars);
    }
}
