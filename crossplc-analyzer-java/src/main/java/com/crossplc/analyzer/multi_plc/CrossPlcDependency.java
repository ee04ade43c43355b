package com.crossplc.analyzer.multi_plc;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * A tag written by routines of {@code writer} and read by routines of each PLC in
 * {@code readers}. Data type and description come from the writer's declaration, if any.
 */
public record CrossPlcDependency(
    @SerializedName("tag")         String tag,
    @SerializedName("writer")      String writer,
    @SerializedName("readers")     List<String> readers,
    @SerializedName("data_type")   String dataType,
    @SerializedName("description") String description
) {}
