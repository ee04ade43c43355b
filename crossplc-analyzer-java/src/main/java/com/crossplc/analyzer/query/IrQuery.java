package com.crossplc.analyzer.query;

import com.crossplc.analyzer.cfg.CfgBuilder;
import com.crossplc.analyzer.dataflow.DataFlowAnalyzer;
import com.crossplc.analyzer.dataflow.RoutineDataFlow;
import com.crossplc.analyzer.interaction.InteractionAnalyzer;
import com.crossplc.analyzer.ir.IrModel.IrDataType;
import com.crossplc.analyzer.ir.IrModel.IrFunctionBlock;
import com.crossplc.analyzer.ir.IrModel.IrProgram;
import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrModel.IrRoutine;
import com.crossplc.analyzer.ir.IrModel.IrTag;
import com.crossplc.analyzer.ir.IrModel.TagScope;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Lookup index over one IR project.
 *
 * Tag lookups cover controller tags and program tags; a controller tag shadows a program
 * tag of the same name. Routines are reachable by {@code name} and {@code program.name}.
 */
public class IrQuery {

    static final int CONTEXT_LINES = 2;
    static final int MAX_CONTEXT_LINES = 10;

    private final IrProject project;

    private final Map<String, IrTag> tagIndex = new LinkedHashMap<>();
    private final Map<String, List<IrTag>> tagsByType = new LinkedHashMap<>();
    private final Map<TagScope, List<IrTag>> tagsByScope = new EnumMap<>(TagScope.class);
    private final Map<String, IrProgram> programIndex = new LinkedHashMap<>();
    private final Map<String, IrRoutine> routineIndex = new LinkedHashMap<>();
    private final Map<String, IrDataType> dataTypeIndex = new LinkedHashMap<>();
    private final Map<String, IrFunctionBlock> functionBlockIndex = new LinkedHashMap<>();

    public IrQuery(IrProject project) {
        this.project = project;
        buildIndexes();
    }

    private void buildIndexes() {
        if (project.controller != null) {
            project.controller.tags.forEach(this::indexTag);
            project.controller.dataTypes.forEach(dt -> dataTypeIndex.putIfAbsent(dt.name, dt));
            project.controller.functionBlocks.forEach(fb -> functionBlockIndex.putIfAbsent(fb.name, fb));
        }
        for (IrProgram program : project.programs) {
            programIndex.putIfAbsent(program.name, program);
            program.tags.forEach(this::indexTag);
            for (IrRoutine routine : program.routines) {
                routineIndex.putIfAbsent(program.name + "." + routine.name, routine);
                routineIndex.putIfAbsent(routine.name, routine);
            }
        }
    }

    private void indexTag(IrTag tag) {
        if (tag == null || tag.name == null || tagIndex.containsKey(tag.name)) return;
        tagIndex.put(tag.name, tag);
        tagsByType.computeIfAbsent(Objects.toString(tag.dataType, ""), k -> new ArrayList<>()).add(tag);
        if (tag.scope != null) {
            tagsByScope.computeIfAbsent(tag.scope, k -> new ArrayList<>()).add(tag);
        }
    }

    public Optional<IrTag> tag(String name) {
        return Optional.ofNullable(tagIndex.get(name));
    }

    /**
     * Tags whose name starts with {@code prefix}, ignoring case. {@code "tank"} finds
     * {@code Tank1_Level} and {@code TANK_PUMP}.
     */
    public List<IrTag> tagsByPrefix(String prefix) {
        String lower = prefix.toLowerCase(Locale.ROOT);
        List<IrTag> matches = new ArrayList<>();
        for (IrTag tag : tagIndex.values()) {
            if (tag.name.toLowerCase(Locale.ROOT).startsWith(lower)) {
                matches.add(tag);
            }
        }
        return matches;
    }

    public List<IrTag> tagsByType(String dataType) {
        return Collections.unmodifiableList(tagsByType.getOrDefault(dataType, List.of()));
    }

    public List<IrTag> tagsByScope(TagScope scope) {
        return Collections.unmodifiableList(tagsByScope.getOrDefault(scope, List.of()));
    }

    /** Tags whose name contains a match of {@code regex}. */
    public List<IrTag> searchTags(String regex, boolean caseSensitive) {
        Pattern pattern = caseSensitive ? Pattern.compile(regex) : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        List<IrTag> matches = new ArrayList<>();
        for (IrTag tag : tagIndex.values()) {
            if (pattern.matcher(tag.name).find()) {
                matches.add(tag);
            }
        }
        return matches;
    }

    public Optional<IrProgram> program(String name) {
        return Optional.ofNullable(programIndex.get(name));
    }

    public Optional<IrRoutine> routine(String name) {
        return Optional.ofNullable(routineIndex.get(name));
    }

    public Optional<IrRoutine> routine(String programName, String routineName) {
        return Optional.ofNullable(routineIndex.get(programName + "." + routineName));
    }

    public Optional<IrDataType> dataType(String name) {
        return Optional.ofNullable(dataTypeIndex.get(name));
    }

    public Optional<IrFunctionBlock> functionBlock(String name) {
        return Optional.ofNullable(functionBlockIndex.get(name));
    }

    /**
     * Routines whose text mentions {@code tagName} (case-insensitive), with up to
     * {@value #MAX_CONTEXT_LINES} lines of surrounding text each.
     */
    public CrossReferences crossReferences(String tagName) {
        String needle = tagName.toLowerCase(Locale.ROOT);
        List<ProgramReferences> programs = new ArrayList<>();
        for (IrProgram program : project.programs) {
            List<RoutineReference> routines = new ArrayList<>();
            for (IrRoutine routine : program.routines) {
                if (!routine.hasContent() || !routine.content.toLowerCase(Locale.ROOT).contains(needle)) continue;
                routines.add(new RoutineReference(
                    routine.name,
                    routine.routineType != null ? routine.routineType.name() : null,
                    contextLines(routine.content, needle)));
            }
            if (!routines.isEmpty()) {
                programs.add(new ProgramReferences(program.name, routines));
            }
        }
        return new CrossReferences(tagName, programs);
    }

    static List<String> contextLines(String content, String needleLower) {
        String[] lines = content.split("\\R", -1);
        List<String> context = new ArrayList<>();
        for (int i = 0; i < lines.length && context.size() < MAX_CONTEXT_LINES; i++) {
            if (!lines[i].toLowerCase(Locale.ROOT).contains(needleLower)) continue;
            int start = Math.max(0, i - CONTEXT_LINES);
            int end = Math.min(lines.length, i + CONTEXT_LINES + 1);
            for (int j = start; j < end && context.size() < MAX_CONTEXT_LINES; j++) {
                context.add(lines[j]);
            }
        }
        return context;
    }

    /**
     * Routines writing and reading {@code tagName} according to their def/use sets, and
     * the programs whose text refers to it.
     */
    public TagUsageInfo tagUsage(String tagName) {
        Map<String, RoutineDataFlow> flows = new DataFlowAnalyzer().analyzeAll(new CfgBuilder().buildAll(project));
        List<String> writers = new ArrayList<>();
        List<String> readers = new ArrayList<>();
        for (RoutineDataFlow flow : flows.values()) {
            if (flow.routine().defs.contains(tagName)) writers.add(flow.routineName());
            if (flow.routine().uses.contains(tagName)) readers.add(flow.routineName());
        }
        Set<String> referencedBy = new InteractionAnalyzer().analyze(project)
            .tagReferences().getOrDefault(tagName, Set.of());
        return new TagUsageInfo(tagName, tagIndex.get(tagName), writers, readers, new ArrayList<>(referencedBy));
    }

    public ProjectSummary summary() {
        Map<String, Integer> routinesByType = new TreeMap<>();
        int routineCount = 0;
        int programTags = 0;
        List<String> programNames = new ArrayList<>();
        for (IrProgram program : project.programs) {
            programNames.add(program.name);
            programTags += program.tags.size();
            for (IrRoutine routine : program.routines) {
                routineCount++;
                routinesByType.merge(routine.routineType != null ? routine.routineType.name() : "UNKNOWN", 1, Integer::sum);
            }
        }
        List<String> dataTypes = new ArrayList<>();
        List<String> functionBlocks = new ArrayList<>();
        int controllerTags = 0;
        if (project.controller != null) {
            controllerTags = project.controller.tags.size();
            project.controller.dataTypes.forEach(dt -> dataTypes.add(dt.name));
            project.controller.functionBlocks.forEach(fb -> functionBlocks.add(fb.name));
        }
        return new ProjectSummary(
            project.controllerName(),
            project.controller != null ? project.controller.description : null,
            controllerTags, programTags, tagIndex.size(),
            programNames, routineCount, routinesByType, dataTypes, functionBlocks);
    }

    /** Counts by scope, data type and leading name segment (text before the first underscore). */
    public TagStatistics tagStatistics() {
        Map<String, Integer> byScope = new TreeMap<>();
        Map<String, Integer> byType = new TreeMap<>();
        Map<String, Integer> byPrefix = new TreeMap<>();
        for (IrTag tag : tagIndex.values()) {
            byScope.merge(tag.scope != null ? tag.scope.label() : "unknown", 1, Integer::sum);
            byType.merge(Objects.toString(tag.dataType, "unknown"), 1, Integer::sum);
            int underscore = tag.name.indexOf('_');
            byPrefix.merge(underscore > 0 ? tag.name.substring(0, underscore) : tag.name, 1, Integer::sum);
        }
        return new TagStatistics(byScope, byType, byPrefix);
    }

    public record RoutineReference(
        @SerializedName("routine_name") String routineName,
        @SerializedName("routine_type") String routineType,
        @SerializedName("context")      List<String> context
    ) {}

    public record ProgramReferences(
        @SerializedName("program_name") String programName,
        @SerializedName("routines")     List<RoutineReference> routines
    ) {}

    public record CrossReferences(
        @SerializedName("tag_name") String tagName,
        @SerializedName("programs") List<ProgramReferences> programs
    ) {
        public boolean isEmpty() {
            return programs.isEmpty();
        }
    }

    public record TagUsageInfo(
        @SerializedName("tag_name")      String tagName,
        @SerializedName("tag_info")      IrTag tag,
        @SerializedName("written_by")    List<String> writers,
        @SerializedName("read_by")       List<String> readers,
        @SerializedName("referenced_by") List<String> referencedBy
    ) {}

    public record ProjectSummary(
        @SerializedName("controller")             String controller,
        @SerializedName("description")            String description,
        @SerializedName("controller_tags")        int controllerTags,
        @SerializedName("program_tags")           int programTags,
        @SerializedName("total_tags")             int totalTags,
        @SerializedName("programs")               List<String> programs,
        @SerializedName("routine_count")          int routineCount,
        @SerializedName("routines_by_type")       Map<String, Integer> routinesByType,
        @SerializedName("data_types")             List<String> dataTypes,
        @SerializedName("function_blocks")        List<String> functionBlocks
    ) {}

    public record TagStatistics(
        @SerializedName("by_scope")  Map<String, Integer> byScope,
        @SerializedName("by_type")   Map<String, Integer> byType,
        @SerializedName("by_prefix") Map<String, Integer> byPrefix
    ) {}
}
