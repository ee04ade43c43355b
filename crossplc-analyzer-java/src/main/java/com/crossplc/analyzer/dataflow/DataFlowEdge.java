package com.crossplc.analyzer.dataflow;

import com.google.gson.annotations.SerializedName;

/**
 * {@code source} routine writes {@code tag} and {@code target} routine reads it.
 */
public record DataFlowEdge(
    @SerializedName("source") String sourceRoutine,
    @SerializedName("target") String targetRoutine,
    @SerializedName("tag")    String tag,
    @SerializedName("type")   String type
) {
    public static final String WRITE_TO_READ = "write_to_read";

    public static DataFlowEdge writeToRead(String source, String target, String tag) {
        return new DataFlowEdge(source, target, tag, WRITE_TO_READ);
    }
}
