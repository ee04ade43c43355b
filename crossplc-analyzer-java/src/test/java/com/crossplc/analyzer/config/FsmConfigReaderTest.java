package com.crossplc.analyzer.config;

import com.crossplc.analyzer.IrFixtures;
import com.crossplc.analyzer.config.FsmConfigReader.FsmConfigReadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FsmConfigReaderTest {

    @TempDir
    Path tempDir;

    private final FsmConfigReader reader = new FsmConfigReader();

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("fsm.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    void singleObjectAppliesToEveryController() throws IOException {
        Path file = write("""
            {
              "state_var": "STEP",
              "rewrite_unknown_sources": true,
              "explicit_states": ["HOLD"]
            }
            """);

        FsmConfig config = reader.read(file, "Any_PLC");

        assertEquals("STEP", config.getStateVar());
        assertTrue(config.isRewriteUnknownSources());
        assertEquals(List.of("HOLD"), config.getExplicitStates());
        assertTrue(config.getPhysicalVars().isEmpty());
    }

    @Test
    void controllerSectionIsSelectedByName() {
        FsmConfig config = reader.read(IrFixtures.WATER_PLANT.resolve("fsm_config.json"), "Plant_PLC");

        assertEquals("STATE", config.getStateVar());
        assertEquals(List.of("TANK_LEVEL", "FLOW_RATE"), config.getPhysicalVars());
        assertEquals(List.of("IDLE", "FILL", "DRAIN", "FAULT"), config.getExpectedStates().get("STATE"));
        assertEquals(List.of(Map.of("to", "FILL"), Map.of("from", "IDLE", "to", "FILL")),
            config.getExpectedTransitions().get("STATE"));
        assertFalse(config.isRewriteUnknownSources());
    }

    @Test
    void unknownControllerFallsBackToDefault() throws IOException {
        Path file = write("""
            {
              "controllers": {
                "A":       { "state_var": "X" },
                "default": { "state_var": "Y" }
              }
            }
            """);
        assertEquals("X", reader.read(file, "A").getStateVar());
        assertEquals("Y", reader.read(file, "B").getStateVar());
    }

    @Test
    void noMatchingSectionIsEmptyConfig() throws IOException {
        Path file = write("{\"controllers\": {\"A\": {\"state_var\": \"X\"}}}");
        FsmConfig config = reader.read(file, "B");
        assertNull(config.getStateVar());
        assertTrue(config.getExpectedStates().isEmpty());
    }

    @Test
    void unknownKeysAreIgnored() throws IOException {
        Path file = write("{\"state_var\": \"STEP\", \"plant_dynamics\": {\"LEVEL\": \"rises\"}}");
        assertEquals("STEP", reader.read(file, null).getStateVar());
    }

    @Test
    void missingFileThrows() {
        FsmConfigReadException e = assertThrows(FsmConfigReadException.class,
            () -> reader.read(tempDir.resolve("absent.json"), "A"));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void malformedFileThrows() throws IOException {
        Path file = write("{\"state_var\": ");
        assertThrows(FsmConfigReadException.class, () -> reader.read(file, "A"));
    }

    @Test
    void nonObjectRootThrows() throws IOException {
        Path file = write("[1, 2]");
        assertThrows(FsmConfigReadException.class, () -> reader.read(file, "A"));
    }

    @Test
    void readOrDefaultToleratesMissingFileAndNullPath() {
        assertNull(reader.readOrDefault(tempDir.resolve("absent.json"), "A").getStateVar());
        assertNull(reader.readOrDefault(null, "A").getStateVar());
    }
}
