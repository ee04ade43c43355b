package com.crossplc.analyzer.fsm;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Comparison of an extracted FSM with the states and transitions the hint file expects.
 * Informational: an invalid result never suppresses the extracted FSM.
 */
public record FsmValidation(
    @SerializedName("valid")               boolean valid,
    @SerializedName("missing_states")      List<String> missingStates,
    @SerializedName("unexpected_states")   List<String> unexpectedStates,
    @SerializedName("missing_transitions") List<String> missingTransitions
) {
    public static FsmValidation notChecked() {
        return new FsmValidation(true, List.of(), List.of(), List.of());
    }
}
