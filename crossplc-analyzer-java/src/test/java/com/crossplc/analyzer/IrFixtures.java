package com.crossplc.analyzer;

import com.crossplc.analyzer.ir.IrModel.IrController;
import com.crossplc.analyzer.ir.IrModel.IrProgram;
import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrModel.IrRoutine;
import com.crossplc.analyzer.ir.IrModel.IrTag;
import com.crossplc.analyzer.ir.IrModel.RoutineType;
import com.crossplc.analyzer.ir.IrModel.SourceType;
import com.crossplc.analyzer.ir.IrModel.TagScope;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Small builders for IR objects used across tests.
 */
public final class IrFixtures {

    /** Repository-level fixtures, resolved from the module directory surefire runs in. */
    public static final Path WATER_PLANT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/water-plant");

    private IrFixtures() {}

    public static IrTag tag(String name, String dataType) {
        return tag(name, dataType, TagScope.CONTROLLER);
    }

    public static IrTag tag(String name, String dataType, TagScope scope) {
        IrTag tag = new IrTag();
        tag.name = name;
        tag.dataType = dataType;
        tag.scope = scope;
        return tag;
    }

    public static IrRoutine routine(String name, String content) {
        IrRoutine routine = new IrRoutine();
        routine.name = name;
        routine.routineType = RoutineType.ST;
        routine.content = content;
        return routine;
    }

    public static IrProgram program(String name, IrRoutine... routines) {
        IrProgram program = new IrProgram();
        program.name = name;
        program.routines = new ArrayList<>(List.of(routines));
        return program;
    }

    public static IrProject project(String controllerName, List<IrTag> controllerTags, IrProgram... programs) {
        IrController controller = new IrController();
        controller.name = controllerName;
        controller.sourceType = SourceType.L5X;
        controller.tags = new ArrayList<>(controllerTags);

        IrProject project = new IrProject();
        project.controller = controller;
        project.programs = new ArrayList<>(List.of(programs));
        return project;
    }

    /** One controller, one program {@code Main}, one routine {@code MainRoutine} holding {@code content}. */
    public static IrProject singleRoutine(String controllerName, String content) {
        return project(controllerName, List.of(), program("Main", routine("MainRoutine", content)));
    }
}
