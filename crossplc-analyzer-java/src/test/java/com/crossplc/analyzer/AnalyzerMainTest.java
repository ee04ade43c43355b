package com.crossplc.analyzer;

import com.crossplc.analyzer.AnalyzerMain.UsageException;
import com.crossplc.analyzer.export.AnalysisSerializer;
import com.crossplc.analyzer.export.GraphExporter;
import com.crossplc.analyzer.ir.IrProjectReader.IrReadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerMainTest {

    @TempDir
    Path tempDir;

    private static String fixture(String name) {
        return IrFixtures.WATER_PLANT.resolve(name).toString();
    }

    private static String usageMessage(String... args) {
        return assertThrows(UsageException.class, () -> AnalyzerMain.run(args)).getMessage();
    }

    @Test
    void usageErrors() {
        assertEquals("No subcommand specified", usageMessage());
        assertEquals("Unknown subcommand: explain", usageMessage("explain"));
        assertEquals("Unknown flag: --verbose", usageMessage("analyze", "--verbose"));
        assertEquals("--ir requires an argument", usageMessage("analyze", "--ir"));
        assertEquals("--ir is required", usageMessage("analyze", "--output", "out"));
        assertEquals("--output is required", usageMessage("analyze", "--ir", "plc.json"));
        assertEquals("--ir is required", usageMessage("validate"));
    }

    @Test
    void multiUsageErrors() {
        assertEquals("multi needs at least two --plc arguments",
            usageMessage("multi", "--plc", "A=a.json", "--output", "out"));
        assertTrue(usageMessage("multi", "--plc", "a.json").startsWith("--plc expects <name>=<file>"));
        assertTrue(usageMessage("multi", "--plc", "A=").startsWith("--plc expects <name>=<file>"));
        assertEquals("Duplicate PLC name: A", usageMessage("multi", "--plc", "A=a.json", "--plc", "A=b.json"));
    }

    @Test
    void analyzeWritesJsonAndGraphs() {
        Path out = tempDir.resolve("analysis");
        int code = AnalyzerMain.run(new String[] {
            "analyze", "--ir", fixture("plc1.json"), "--fsm-config", fixture("fsm_config.json"),
            "--output", out.toString()});

        assertEquals(0, code);
        assertTrue(Files.exists(out.resolve(AnalysisSerializer.PROJECT_FILE)));
        assertTrue(Files.exists(out.resolve(AnalysisSerializer.METADATA_FILE)));
        assertTrue(Files.exists(out.resolve(GraphExporter.CFG_DOT)));
        assertTrue(Files.exists(out.resolve(GraphExporter.DATAFLOW_GRAPHML)));
        assertTrue(Files.exists(out.resolve(GraphExporter.FSM_DOT)));
    }

    @Test
    void analyzeContinuesWithoutUnreadableHints() {
        Path out = tempDir.resolve("analysis");
        int code = AnalyzerMain.run(new String[] {
            "analyze", "--ir", fixture("plc2.json"), "--fsm-config", tempDir.resolve("absent.json").toString(),
            "--output", out.toString()});
        assertEquals(0, code);
    }

    @Test
    void multiWritesReport() {
        Path out = tempDir.resolve("multi");
        int code = AnalyzerMain.run(new String[] {
            "multi", "--plc", "PLC1=" + fixture("plc1.json"), "--plc", "PLC2=" + fixture("plc2.json"),
            "--parallel", "--output", out.toString()});

        assertEquals(0, code);
        assertTrue(Files.exists(out.resolve(AnalysisSerializer.MULTI_PLC_FILE)));
    }

    @Test
    void validateExitCodes() throws IOException {
        assertEquals(0, AnalyzerMain.run(new String[] {"validate", "--ir", fixture("plc1.json")}));

        Path invalid = Files.writeString(tempDir.resolve("invalid.json"),
            "{\"controller\": {\"name\": \"C\"}, \"programs\": []}");
        assertEquals(1, AnalyzerMain.run(new String[] {"validate", "--ir", invalid.toString()}));
    }

    @Test
    void unreadableIrPropagates() {
        assertThrows(IrReadException.class, () -> AnalyzerMain.run(new String[] {
            "validate", "--ir", tempDir.resolve("missing.json").toString()}));
    }
}
