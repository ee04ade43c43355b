package com.crossplc.analyzer.interaction;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of {@link InteractionAnalyzer}.
 *
 * @param programTags   program name -> tags the program declares or mentions
 * @param tagReferences tag name -> programs whose routines mention it
 */
public record InteractionReport(
    @SerializedName("program_tags")   Map<String, Set<String>> programTags,
    @SerializedName("tag_references") Map<String, Set<String>> tagReferences,
    @SerializedName("interactions")   List<Interaction> interactions
) {
    public List<Interaction> ofType(Interaction.Type type) {
        return interactions.stream().filter(i -> i.type() == type).toList();
    }

    public Summary summary() {
        return new Summary(
            interactions.size(),
            ofType(Interaction.Type.CROSS_PROGRAM).size(),
            ofType(Interaction.Type.PROGRAM_TO_CONTROLLER).size());
    }

    public record Summary(
        @SerializedName("total_interactions")              int total,
        @SerializedName("cross_program_interactions")      int crossProgram,
        @SerializedName("program_controller_interactions") int programToController
    ) {}
}
