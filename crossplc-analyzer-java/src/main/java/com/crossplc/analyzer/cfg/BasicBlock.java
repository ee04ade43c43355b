package com.crossplc.analyzer.cfg;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

/**
 * A straight-line run of routine statements. Control blocks also carry the guard text of
 * the construct that opened them; IF blocks carry explicit true/false successors.
 */
public class BasicBlock {

    public enum Kind {
        @SerializedName("basic")  BASIC,
        @SerializedName("branch") BRANCH,
        @SerializedName("loop")   LOOP,
        @SerializedName("switch") SWITCH
    }

    @SerializedName("block_id")        public final String id;
    @SerializedName("type")            public final Kind kind;
    @SerializedName("instructions")    public final List<String> instructions = new ArrayList<>();
    @SerializedName("successors")      public final List<String> successors = new ArrayList<>();
    @SerializedName("condition")       public String condition;       // control blocks only
    @SerializedName("true_successor")  public String trueSuccessor;   // IF blocks only
    @SerializedName("false_successor") public String falseSuccessor;  // IF blocks only

    public BasicBlock(String id, Kind kind) {
        this.id = id;
        this.kind = kind;
    }

    public boolean isControl() {
        return kind != Kind.BASIC;
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    void addSuccessor(String blockId) {
        if (blockId != null && !successors.contains(blockId)) {
            successors.add(blockId);
        }
    }

    @Override
    public String toString() {
        return id + "(" + kind + ", " + instructions.size() + " instructions) -> " + successors;
    }
}
