package com.crossplc.analyzer.interaction;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Two parts of one controller connected through the tags in {@code via}.
 */
public record Interaction(
    @SerializedName("source") String source,
    @SerializedName("target") String target,
    @SerializedName("via")    List<String> via,
    @SerializedName("type")   Type type
) {
    public enum Type {
        @SerializedName("cross_program")         CROSS_PROGRAM,
        @SerializedName("program_to_controller") PROGRAM_TO_CONTROLLER
    }
}
