package com.crossplc.analyzer.multi_plc;

import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrModel.IrProgram;
import com.crossplc.analyzer.ir.IrModel.IrRoutine;
import com.crossplc.analyzer.ir.IrModel.IrTag;
import com.crossplc.analyzer.text.LineClassifier;
import com.crossplc.analyzer.text.LineClassifier.Assignment;
import com.crossplc.analyzer.text.LineClassifier.ClassifiedLine;
import com.crossplc.analyzer.text.TagExtractor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tag writes, reads and controller declarations of a single PLC.
 * Built from one project only, so several PLCs can be scanned independently.
 */
final class TagUsage {

    record TagDefinition(String dataType, String scope, String description) {}

    final String plcName;
    final Map<String, List<String>> writers = new LinkedHashMap<>();  // tag -> routines
    final Map<String, List<String>> readers = new LinkedHashMap<>();  // tag -> routines
    final Map<String, TagDefinition> definitions = new LinkedHashMap<>();

    private TagUsage(String plcName) {
        this.plcName = plcName;
    }

    static TagUsage scan(String plcName, IrProject project) {
        TagUsage usage = new TagUsage(plcName);
        if (project.controller != null) {
            for (IrTag tag : project.controller.tags) {
                usage.definitions.put(tag.name, new TagDefinition(
                    tag.dataType,
                    tag.scope != null ? tag.scope.label() : null,
                    tag.description));
            }
        }
        for (IrProgram program : project.programs) {
            for (IrRoutine routine : program.routines) {
                if (routine.hasContent()) {
                    usage.scanRoutine(routine);
                }
            }
        }
        return usage;
    }

    private void scanRoutine(IrRoutine routine) {
        for (String rawLine : routine.content.split("\\R")) {
            ClassifiedLine line = LineClassifier.classify(rawLine);
            if (line.isSkippable()) continue;

            for (Assignment assignment : line.assignments()) {
                String written = TagExtractor.extractTag(assignment.target());
                if (written != null) {
                    addUsage(writers, written, routine.name);
                }
                for (String read : TagExtractor.extractTags(assignment.value())) {
                    addUsage(readers, read, routine.name);
                }
            }
            if ("IF".equals(line.keyword()) && line.hasCondition()) {
                for (String read : TagExtractor.extractTags(line.condition())) {
                    addUsage(readers, read, routine.name);
                }
            }
        }
    }

    private static void addUsage(Map<String, List<String>> usage, String tag, String routineName) {
        usage.computeIfAbsent(tag, k -> new ArrayList<>()).add(routineName);
    }
}
