package com.crossplc.analyzer.multi_plc;

import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.multi_plc.ConflictingTag.ConflictKind;
import com.crossplc.analyzer.multi_plc.TagUsage.TagDefinition;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Correlates tags across independently parsed PLC projects.
 *
 * Tags are matched by name only. Every PLC is scanned on its own (optionally in parallel);
 * the per-PLC results are then merged on the calling thread in input order.
 */
public class MultiPlcAnalyzer {

    private final Map<String, IrProject> plcIrMap;

    // tag -> plc -> routines
    private final Map<String, Map<String, List<String>>> tagWriters = new LinkedHashMap<>();
    private final Map<String, Map<String, List<String>>> tagReaders = new LinkedHashMap<>();
    // tag -> plc -> controller declaration
    private final Map<String, Map<String, TagDefinition>> tagDefinitions = new LinkedHashMap<>();

    public MultiPlcAnalyzer(Map<String, IrProject> plcIrMap) {
        this(plcIrMap, false);
    }

    public MultiPlcAnalyzer(Map<String, IrProject> plcIrMap, boolean parallelScan) {
        this.plcIrMap = Collections.unmodifiableMap(new LinkedHashMap<>(plcIrMap));
        buildTagUsageMaps(parallelScan);
    }

    public List<String> plcNames() {
        return new ArrayList<>(plcIrMap.keySet());
    }

    private void buildTagUsageMaps(boolean parallelScan) {
        Stream<Map.Entry<String, IrProject>> entries = parallelScan
                ? plcIrMap.entrySet().parallelStream()
                : plcIrMap.entrySet().stream();
        List<TagUsage> usages = entries
                .map(e -> TagUsage.scan(e.getKey(), e.getValue()))
                .collect(Collectors.toList());

        for (TagUsage usage : usages) {
            usage.definitions.forEach((tag, def) ->
                tagDefinitions.computeIfAbsent(tag, k -> new LinkedHashMap<>()).put(usage.plcName, def));
            merge(tagWriters, usage.writers, usage.plcName);
            merge(tagReaders, usage.readers, usage.plcName);
        }
    }

    private static void merge(Map<String, Map<String, List<String>>> target,
                              Map<String, List<String>> perPlc, String plcName) {
        perPlc.forEach((tag, routines) ->
            target.computeIfAbsent(tag, k -> new LinkedHashMap<>())
                  .computeIfAbsent(plcName, k -> new ArrayList<>())
                  .addAll(routines));
    }

    /**
     * One dependency per (tag, writer PLC, reader PLC) with writer != reader.
     * A tag written by two PLCs and read by a third yields two records.
     */
    public List<CrossPlcDependency> findCrossPlcDependencies() {
        List<CrossPlcDependency> dependencies = new ArrayList<>();
        for (Map.Entry<String, Map<String, List<String>>> entry : tagWriters.entrySet()) {
            String tag = entry.getKey();
            Map<String, List<String>> readers = tagReaders.get(tag);
            if (readers == null) continue;

            for (String writerPlc : entry.getValue().keySet()) {
                for (String readerPlc : readers.keySet()) {
                    if (writerPlc.equals(readerPlc)) continue;
                    TagDefinition def = tagDefinitions.getOrDefault(tag, Map.of()).get(writerPlc);
                    dependencies.add(new CrossPlcDependency(
                        tag,
                        writerPlc,
                        List.of(readerPlc),
                        def != null ? def.dataType() : null,
                        def != null ? def.description() : null));
                }
            }
        }
        return dependencies;
    }

    /**
     * Compares controller tag declarations of every tag name declared by more than one PLC.
     * Data type and scope are checked independently, so one tag can yield two conflicts.
     */
    public List<ConflictingTag> detectConflictingTags() {
        List<ConflictingTag> conflicts = new ArrayList<>();
        for (Map.Entry<String, Map<String, TagDefinition>> entry : tagDefinitions.entrySet()) {
            Map<String, TagDefinition> definitions = entry.getValue();
            if (definitions.size() < 2) continue;

            String tag = entry.getKey();
            List<String> plcs = new ArrayList<>(definitions.keySet());

            conflictOn(tag, plcs, definitions, TagDefinition::dataType, ConflictKind.DIFFERENT_DATA_TYPES)
                .ifPresent(conflicts::add);
            conflictOn(tag, plcs, definitions, TagDefinition::scope, ConflictKind.DIFFERENT_SCOPES)
                .ifPresent(conflicts::add);
        }
        return conflicts;
    }

    private static Optional<ConflictingTag> conflictOn(
            String tag, List<String> plcs, Map<String, TagDefinition> definitions,
            Function<TagDefinition, String> attribute, ConflictKind kind) {
        Set<String> distinct = new HashSet<>();
        Map<String, String> details = new LinkedHashMap<>();
        definitions.forEach((plc, def) -> {
            distinct.add(attribute.apply(def));
            details.put(plc, attribute.apply(def));
        });
        if (distinct.size() > 1) {
            return Optional.of(new ConflictingTag(tag, plcs, kind, details));
        }
        return Optional.empty();
    }

    /** Tags written by at least one PLC and read by a different one. */
    public Set<String> sharedTags() {
        Set<String> shared = new LinkedHashSet<>();
        for (CrossPlcDependency dep : findCrossPlcDependencies()) {
            shared.add(dep.tag());
        }
        return shared;
    }

    /** PLC name -> routines writing {@code tag}; empty if nobody writes it. */
    public Map<String, List<String>> writersOf(String tag) {
        return Collections.unmodifiableMap(tagWriters.getOrDefault(tag, Map.of()));
    }

    /** PLC name -> routines reading {@code tag}; empty if nobody reads it. */
    public Map<String, List<String>> readersOf(String tag) {
        return Collections.unmodifiableMap(tagReaders.getOrDefault(tag, Map.of()));
    }

    public MultiPlcSummary summary() {
        return summary(findCrossPlcDependencies(), detectConflictingTags());
    }

    public MultiPlcSummary summary(List<CrossPlcDependency> dependencies, List<ConflictingTag> conflicts) {
        Map<String, MultiPlcSummary.PlcSummary> perPlc = new LinkedHashMap<>();
        plcIrMap.forEach((name, project) -> perPlc.put(name, new MultiPlcSummary.PlcSummary(
            project.controller != null ? project.controller.tags.size() : 0,
            project.programs.size(),
            project.allRoutines().size(),
            project.controller != null ? Objects.toString(project.controller.sourceType, "unknown") : "unknown")));
        return new MultiPlcSummary(plcNames().size(), plcNames(), dependencies.size(), conflicts.size(), perPlc);
    }

    public record MultiPlcSummary(
        @SerializedName("total_plcs")        int totalPlcs,
        @SerializedName("plc_names")         List<String> plcNames,
        @SerializedName("total_shared_tags") int totalDependencies,
        @SerializedName("total_conflicts")   int totalConflicts,
        @SerializedName("plc_summary")       Map<String, PlcSummary> plcSummary
    ) {
        public record PlcSummary(
            @SerializedName("controller_tags") int controllerTags,
            @SerializedName("programs")        int programs,
            @SerializedName("routines")        int routines,
            @SerializedName("source")          String source
        ) {}
    }
}
