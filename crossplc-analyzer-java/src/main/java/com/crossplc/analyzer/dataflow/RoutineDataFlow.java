package com.crossplc.analyzer.dataflow;

import com.google.gson.annotations.SerializedName;

import java.util.Map;

/**
 * Def/use sets of every block of one routine plus their union for the routine.
 */
public record RoutineDataFlow(
    @SerializedName("routine") String routineName,
    @SerializedName("blocks")  Map<String, DefUse> blocks,
    @SerializedName("routine_def_use") DefUse routine
) {
    public DefUse block(String blockId) {
        return blocks.get(blockId);
    }
}
