package com.crossplc.analyzer.interaction;

import com.crossplc.analyzer.ir.IrModel.IrProgram;
import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrModel.IrRoutine;
import com.crossplc.analyzer.ir.IrModel.IrTag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Finds programs of one controller that share tags, and programs that use controller tags.
 *
 * A routine mentions a tag when the tag name occurs anywhere in its text, ignoring case.
 * This is substring containment, not tokenization: {@code PUMP} is found inside
 * {@code PUMP_SPEED}.
 */
public class InteractionAnalyzer {

    public InteractionReport analyze(IrProject project) {
        String controllerName = project.controllerName();
        Set<String> knownTags = knownTagNames(project);

        Map<String, Set<String>> programTags = new LinkedHashMap<>();
        Map<String, Set<String>> tagReferences = new LinkedHashMap<>();
        for (String tag : knownTags) {
            tagReferences.put(tag, new LinkedHashSet<>());
        }

        for (IrProgram program : project.programs) {
            Set<String> tags = new LinkedHashSet<>();
            program.tags.forEach(t -> tags.add(t.name));
            program.localVariables.forEach(t -> tags.add(t.name));

            for (IrRoutine routine : program.routines) {
                if (!routine.hasContent()) continue;
                String content = routine.content.toLowerCase(Locale.ROOT);
                for (String tag : knownTags) {
                    if (content.contains(tag.toLowerCase(Locale.ROOT))) {
                        tags.add(tag);
                        tagReferences.get(tag).add(program.name);
                    }
                }
            }
            programTags.put(program.name, tags);
        }

        List<Interaction> interactions = new ArrayList<>();
        for (IrProgram program : project.programs) {
            for (IrProgram other : project.programs) {
                if (program.name.equals(other.name)) continue;
                Set<String> shared = intersect(programTags.get(program.name), programTags.get(other.name));
                if (!shared.isEmpty()) {
                    interactions.add(new Interaction(
                        controllerName + "." + program.name,
                        controllerName + "." + other.name,
                        new ArrayList<>(shared),
                        Interaction.Type.CROSS_PROGRAM));
                }
            }
        }

        Set<String> controllerTags = new LinkedHashSet<>();
        if (project.controller != null) {
            project.controller.tags.forEach(t -> controllerTags.add(t.name));
        }
        for (IrProgram program : project.programs) {
            Set<String> used = intersect(programTags.get(program.name), controllerTags);
            if (!used.isEmpty()) {
                interactions.add(new Interaction(
                    controllerName + "." + program.name,
                    controllerName,
                    new ArrayList<>(used),
                    Interaction.Type.PROGRAM_TO_CONTROLLER));
            }
        }

        return new InteractionReport(programTags, tagReferences, interactions);
    }

    /** Controller tags, then every program's tags and local variables. */
    static Set<String> knownTagNames(IrProject project) {
        Set<String> names = new LinkedHashSet<>();
        if (project.controller != null) {
            for (IrTag tag : project.controller.tags) names.add(tag.name);
        }
        for (IrProgram program : project.programs) {
            for (IrTag tag : program.tags) names.add(tag.name);
            for (IrTag tag : program.localVariables) names.add(tag.name);
        }
        names.remove(null);
        return names;
    }

    private static Set<String> intersect(Set<String> a, Set<String> b) {
        Set<String> result = new LinkedHashSet<>(a);
        result.retainAll(b);
        return result;
    }
}
