package com.crossplc.analyzer.ir;

import com.crossplc.analyzer.ir.IrModel.IrController;
import com.crossplc.analyzer.ir.IrModel.IrDataType;
import com.crossplc.analyzer.ir.IrModel.IrFunctionBlock;
import com.crossplc.analyzer.ir.IrModel.IrProgram;
import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrModel.IrRoutine;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads an IR project document produced by one of the format front-ends.
 * Lists the document omits (or sets to null) come back empty, never null.
 */
public class IrProjectReader {

    private static final Gson GSON = new Gson();

    /**
     * @throws IrReadException if the file is missing, empty or not valid IR JSON
     */
    public IrProject read(Path irPath) {
        if (!irPath.toFile().exists()) {
            throw new IrReadException("IR file not found: " + irPath);
        }
        try (FileReader reader = new FileReader(irPath.toFile())) {
            IrProject project = GSON.fromJson(reader, IrProject.class);
            if (project == null) {
                throw new IrReadException("IR file is empty or invalid JSON: " + irPath);
            }
            return normalize(project);
        } catch (FileNotFoundException e) {
            throw new IrReadException("IR file not found: " + irPath, e);
        } catch (IOException | JsonParseException e) {
            throw new IrReadException("Failed to read IR: " + irPath + ": " + e.getMessage(), e);
        }
    }

    static IrProject normalize(IrProject project) {
        project.programs = orEmpty(project.programs);
        project.tasks = orEmpty(project.tasks);
        project.modules = orEmpty(project.modules);
        if (project.metadata == null) project.metadata = new LinkedHashMap<>();

        IrController controller = project.controller;
        if (controller != null) {
            controller.tags = orEmpty(controller.tags);
            controller.dataTypes = orEmpty(controller.dataTypes);
            controller.functionBlocks = orEmpty(controller.functionBlocks);
            for (IrDataType dataType : controller.dataTypes) {
                dataType.members = orEmpty(dataType.members);
            }
            for (IrFunctionBlock fb : controller.functionBlocks) {
                fb.inputs = orEmpty(fb.inputs);
                fb.outputs = orEmpty(fb.outputs);
                fb.locals = orEmpty(fb.locals);
            }
        }
        project.programs.removeIf(p -> p == null);
        for (IrProgram program : project.programs) {
            program.routines = orEmpty(program.routines);
            program.routines.removeIf((IrRoutine r) -> r == null);
            program.tags = orEmpty(program.tags);
            program.localVariables = orEmpty(program.localVariables);
        }
        return project;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : new ArrayList<>();
    }

    public static class IrReadException extends RuntimeException {
        public IrReadException(String message) { super(message); }
        public IrReadException(String message, Throwable cause) { super(message, cause); }
    }
}
