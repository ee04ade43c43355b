package com.crossplc.analyzer.dataflow;

import com.google.gson.annotations.SerializedName;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tags written ({@code defs}) and read ({@code uses}) by one block or routine.
 */
public class DefUse {

    @SerializedName("defs") public final Set<String> defs = new LinkedHashSet<>();
    @SerializedName("uses") public final Set<String> uses = new LinkedHashSet<>();

    void addAll(DefUse other) {
        defs.addAll(other.defs);
        uses.addAll(other.uses);
    }

    public boolean isEmpty() {
        return defs.isEmpty() && uses.isEmpty();
    }
}
