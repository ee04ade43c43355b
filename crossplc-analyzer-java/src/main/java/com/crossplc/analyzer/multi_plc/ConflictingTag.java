package com.crossplc.analyzer.multi_plc;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * A tag name declared by several PLCs with incompatible definitions.
 *
 * @param details PLC name -> that PLC's value of the conflicting attribute
 */
public record ConflictingTag(
    @SerializedName("tag")      String tag,
    @SerializedName("plcs")     List<String> plcs,
    @SerializedName("conflict") ConflictKind kind,
    @SerializedName("details")  Map<String, String> details
) {
    public enum ConflictKind {
        @SerializedName("different_data_types") DIFFERENT_DATA_TYPES,
        @SerializedName("different_scopes")     DIFFERENT_SCOPES
    }
}
