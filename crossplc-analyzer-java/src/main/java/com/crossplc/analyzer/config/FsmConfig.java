package com.crossplc.analyzer.config;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Deserialized form of one controller section of the FSM hint file.
 * Every hint is advisory; an empty config is valid.
 */
public class FsmConfig {

    /** Preferred state variable; accepted only if the code gives it enough evidence. */
    @SerializedName("state_var")
    private String stateVar;

    /** Process variables (positions, temperatures) to report when the code touches them. */
    @SerializedName("physical_vars")
    private List<String> physicalVars;

    /** States added to the extracted FSM even when the code never assigns them. */
    @SerializedName("explicit_states")
    private List<String> explicitStates;

    /** State variable -> states the FSM is expected to have. */
    @SerializedName("expected_states")
    private Map<String, List<String>> expectedStates;

    /** State variable -> expected transitions, each with a "to" and optional "from". */
    @SerializedName("expected_transitions")
    private Map<String, List<Map<String, String>>> expectedTransitions;

    /** Whether "UNKNOWN" transition sources are reported as "CURRENT_STATE" (default: false). */
    @SerializedName("rewrite_unknown_sources")
    private Boolean rewriteUnknownSources;

    public static FsmConfig empty() {
        return new FsmConfig();
    }

    public String getStateVar()              { return stateVar; }
    public List<String> getPhysicalVars()    { return physicalVars   != null ? physicalVars   : Collections.emptyList(); }
    public List<String> getExplicitStates()  { return explicitStates != null ? explicitStates : Collections.emptyList(); }
    public Map<String, List<String>> getExpectedStates() {
        return expectedStates != null ? expectedStates : Collections.emptyMap();
    }
    public Map<String, List<Map<String, String>>> getExpectedTransitions() {
        return expectedTransitions != null ? expectedTransitions : Collections.emptyMap();
    }
    public boolean isRewriteUnknownSources() { return rewriteUnknownSources != null && rewriteUnknownSources; }

    public FsmConfig withStateVar(String stateVar) {
        this.stateVar = stateVar;
        return this;
    }

    public FsmConfig withPhysicalVars(List<String> physicalVars) {
        this.physicalVars = physicalVars;
        return this;
    }

    public FsmConfig withExplicitStates(List<String> explicitStates) {
        this.explicitStates = explicitStates;
        return this;
    }

    public FsmConfig withExpectedStates(String stateVar, List<String> states) {
        this.expectedStates = Map.of(stateVar, states);
        return this;
    }

    public FsmConfig withExpectedTransitions(String stateVar, List<Map<String, String>> transitions) {
        this.expectedTransitions = Map.of(stateVar, transitions);
        return this;
    }

    public FsmConfig withRewriteUnknownSources(boolean rewrite) {
        this.rewriteUnknownSources = rewrite;
        return this;
    }
}
