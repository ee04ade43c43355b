package com.crossplc.analyzer.cfg;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Optional;

/**
 * Control-flow graph of one routine. The first block is always {@link CfgBuilder#ENTRY}.
 */
public record RoutineCfg(
    @SerializedName("routine")      String routineName,
    @SerializedName("program")      String programName,
    @SerializedName("routine_type") String routineType,
    @SerializedName("blocks")       List<BasicBlock> blocks
) {
    public BasicBlock entry() {
        return blocks.get(0);
    }

    public Optional<BasicBlock> block(String id) {
        return blocks.stream().filter(b -> b.id.equals(id)).findFirst();
    }

    public int edgeCount() {
        return blocks.stream().mapToInt(b -> b.successors.size()).sum();
    }
}
