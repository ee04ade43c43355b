package com.crossplc.analyzer.ir;

import com.crossplc.analyzer.ir.IrModel.IrProgram;
import com.crossplc.analyzer.ir.IrModel.IrProject;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks a project must pass before its analysis results mean anything.
 * Reports problems; never throws and never aborts on its own.
 */
public final class IrValidator {

    private IrValidator() {}

    public static List<String> validate(IrProject project) {
        List<String> errors = new ArrayList<>();

        if (project.controller == null || project.controller.name == null || project.controller.name.isBlank()) {
            errors.add("Controller missing or unnamed.");
        }
        if (project.controller == null || project.controller.tags.isEmpty()) {
            errors.add("No controller tags found.");
        }
        if (project.programs.isEmpty()) {
            errors.add("No programs found.");
        }
        for (IrProgram program : project.programs) {
            if (program.routines.isEmpty()) {
                errors.add("Program '" + program.name + "' has no routines.");
            }
        }
        return errors;
    }
}
