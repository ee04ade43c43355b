package com.crossplc.analyzer.export;

import com.crossplc.analyzer.analysis.MultiPlcReport;
import com.crossplc.analyzer.analysis.ProjectAnalysis;
import com.crossplc.analyzer.dataflow.DataFlowEdge;
import com.crossplc.analyzer.interaction.Interaction;
import com.crossplc.analyzer.interaction.InteractionReport;
import com.crossplc.analyzer.multi_plc.ConflictingTag;
import com.crossplc.analyzer.multi_plc.CrossPlcDependency;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Writes analysis results as pretty-printed JSON plus a {@code metadata.json}.
 * Record lists whose order carries no meaning are sorted first so that two runs over the
 * same input produce identical files.
 */
public class AnalysisSerializer {

    public static final String PROJECT_FILE = "analysis.json";
    public static final String MULTI_PLC_FILE = "multi_plc.json";
    public static final String METADATA_FILE = "metadata.json";
    static final String ANALYZER_VERSION = "0.1.0";

    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());
    private static final Comparator<DataFlowEdge> EDGE_ORDER =
        Comparator.comparing(DataFlowEdge::sourceRoutine, NULLS_FIRST)
                  .thenComparing(DataFlowEdge::targetRoutine, NULLS_FIRST)
                  .thenComparing(DataFlowEdge::tag, NULLS_FIRST);
    private static final Comparator<Interaction> INTERACTION_ORDER =
        Comparator.comparing((Interaction i) -> i.type().name())
                  .thenComparing(Interaction::source)
                  .thenComparing(Interaction::target);
    private static final Comparator<CrossPlcDependency> DEPENDENCY_ORDER =
        Comparator.comparing(CrossPlcDependency::tag)
                  .thenComparing(CrossPlcDependency::writer)
                  .thenComparing(d -> String.join(",", d.readers()));
    private static final Comparator<ConflictingTag> CONFLICT_ORDER =
        Comparator.comparing(ConflictingTag::tag)
                  .thenComparing(c -> c.kind().name());

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Writes {@code outputDir/analysis.json} and {@code outputDir/metadata.json}.
     *
     * @return the path of the analysis file
     */
    public Path write(ProjectAnalysis analysis, Path outputDir) {
        createDirectories(outputDir);
        Path path = outputDir.resolve(PROJECT_FILE);
        writeJson(sorted(analysis), path);
        writeJson(new Metadata(analysis.controller(), "project", ANALYZER_VERSION, Instant.now().toString()),
                outputDir.resolve(METADATA_FILE));
        return path;
    }

    /**
     * Writes {@code outputDir/multi_plc.json} and {@code outputDir/metadata.json}.
     *
     * @return the path of the report file
     */
    public Path write(MultiPlcReport report, Path outputDir) {
        createDirectories(outputDir);
        Path path = outputDir.resolve(MULTI_PLC_FILE);
        writeJson(sorted(report), path);
        writeJson(new Metadata(String.join(",", report.summary().plcNames()), "multi_plc", ANALYZER_VERSION,
                Instant.now().toString()), outputDir.resolve(METADATA_FILE));
        return path;
    }

    public String toJson(Object value) {
        return gson.toJson(value);
    }

    static ProjectAnalysis sorted(ProjectAnalysis analysis) {
        InteractionReport interactions = analysis.interactions();
        InteractionReport sortedInteractions = new InteractionReport(
            interactions.programTags(),
            interactions.tagReferences(),
            sortedCopy(interactions.interactions(), INTERACTION_ORDER));
        return new ProjectAnalysis(
            analysis.controller(),
            analysis.validationErrors(),
            analysis.cfgs(),
            analysis.dataFlow(),
            sortedCopy(analysis.interRoutineEdges(), EDGE_ORDER),
            sortedInteractions,
            analysis.fsm());
    }

    static MultiPlcReport sorted(MultiPlcReport report) {
        return new MultiPlcReport(
            report.summary(),
            sortedCopy(report.dependencies(), DEPENDENCY_ORDER),
            sortedCopy(report.conflicts(), CONFLICT_ORDER),
            report.compositeFsm());
    }

    private static <T> List<T> sortedCopy(List<T> list, Comparator<T> order) {
        List<T> copy = new ArrayList<>(list);
        copy.sort(order);
        return copy;
    }

    private void writeJson(Object value, Path path) {
        try (Writer w = new FileWriter(path.toFile())) {
            gson.toJson(value, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + path.getFileName() + ": " + e.getMessage(), e);
        }
        System.err.println("[crossplc] " + path.getFileName() + " written: " + path);
    }

    static void createDirectories(Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }
    }

    private record Metadata(
            @SerializedName("subject")          String subject,
            @SerializedName("kind")             String kind,
            @SerializedName("analyzer_version") String analyzerVersion,
            @SerializedName("timestamp")        String timestamp
    ) {}
}
