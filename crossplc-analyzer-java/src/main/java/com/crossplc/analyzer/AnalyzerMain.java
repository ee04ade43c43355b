package com.crossplc.analyzer;

import com.crossplc.analyzer.analysis.AnalysisSession;
import com.crossplc.analyzer.analysis.MultiPlcReport;
import com.crossplc.analyzer.analysis.ProjectAnalysis;
import com.crossplc.analyzer.config.FsmConfig;
import com.crossplc.analyzer.config.FsmConfigReader;
import com.crossplc.analyzer.export.AnalysisSerializer;
import com.crossplc.analyzer.export.GraphExporter;
import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrProjectReader;
import com.crossplc.analyzer.ir.IrValidator;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 *
 * Usage:
 *   java -jar crossplc-analyzer-java.jar analyze  --ir <ir.json> [--fsm-config <hints.json>] --output <dir>
 *   java -jar crossplc-analyzer-java.jar multi    --plc <name>=<ir.json> --plc <name>=<ir.json> ...
 *                                                 [--fsm-config <hints.json>] [--parallel] --output <dir>
 *   java -jar crossplc-analyzer-java.jar validate --ir <ir.json>
 */
public class AnalyzerMain {

    static final String USAGE = "Usage: java -jar crossplc-analyzer-java.jar "
            + "analyze --ir <file> [--fsm-config <file>] --output <dir> | "
            + "multi --plc <name>=<file> --plc <name>=<file> [--fsm-config <file>] [--parallel] --output <dir> | "
            + "validate --ir <file>";

    public static void main(String[] args) {
        try {
            System.exit(run(args));
        } catch (UsageException e) {
            System.err.println("[crossplc] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[crossplc] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    /** Runs one subcommand and returns the process exit code. */
    static int run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        Options options = Options.parse(args);
        return switch (args[0]) {
            case "analyze"  -> analyze(options);
            case "multi"    -> multi(options);
            case "validate" -> validate(options);
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        };
    }

    private static int analyze(Options options) {
        if (options.irPath == null)  throw new UsageException("--ir is required");
        if (options.outputDir == null) throw new UsageException("--output is required");
        Path output = Paths.get(options.outputDir);

        System.err.println("[crossplc] Reading IR: " + options.irPath);
        IrProject project = new IrProjectReader().read(Paths.get(options.irPath));
        FsmConfig fsmConfig = new FsmConfigReader().readOrDefault(options.fsmConfigPath(), project.controllerName());

        ProjectAnalysis analysis = new AnalysisSession().analyzeProject(project, fsmConfig);

        System.err.println("[crossplc] Writing output to: " + output);
        new AnalysisSerializer().write(analysis, output);
        GraphExporter exporter = new GraphExporter();
        exporter.write(analysis.cfgs(), analysis.interRoutineEdges(), output);
        analysis.fsm().stateMachine().ifPresent(fsm -> exporter.writeFsm(fsm, output));

        System.err.println("[crossplc] Done.");
        return 0;
    }

    private static int multi(Options options) {
        if (options.plcs.size() < 2) throw new UsageException("multi needs at least two --plc arguments");
        if (options.outputDir == null) throw new UsageException("--output is required");
        Path output = Paths.get(options.outputDir);

        IrProjectReader reader = new IrProjectReader();
        Map<String, IrProject> projects = new LinkedHashMap<>();
        for (Map.Entry<String, String> plc : options.plcs.entrySet()) {
            System.err.println("[crossplc] Reading IR for " + plc.getKey() + ": " + plc.getValue());
            projects.put(plc.getKey(), reader.read(Paths.get(plc.getValue())));
        }

        FsmConfigReader configReader = new FsmConfigReader();
        Path fsmConfigPath = options.fsmConfigPath();
        MultiPlcReport report = new AnalysisSession().analyzePlcs(projects, options.parallel,
                controller -> configReader.readOrDefault(fsmConfigPath, controller));

        System.err.println("[crossplc] Writing output to: " + output);
        new AnalysisSerializer().write(report, output);

        System.err.println("[crossplc] Done.");
        return 0;
    }

    private static int validate(Options options) {
        if (options.irPath == null) throw new UsageException("--ir is required");

        IrProject project = new IrProjectReader().read(Paths.get(options.irPath));
        List<String> errors = IrValidator.validate(project);
        if (errors.isEmpty()) {
            System.err.println("[crossplc] IR is valid: " + options.irPath);
            return 0;
        }
        for (String error : errors) {
            System.err.println("[crossplc] INVALID: " + error);
        }
        return 1;
    }

    static final class Options {
        String irPath;
        String outputDir;
        String fsmConfig;
        boolean parallel;
        final Map<String, String> plcs = new LinkedHashMap<>();

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 1; i < args.length; i++) {
                switch (args[i]) {
                    case "--ir"         -> options.irPath    = requireNext(args, i++, "--ir");
                    case "--output"     -> options.outputDir = requireNext(args, i++, "--output");
                    case "--fsm-config" -> options.fsmConfig = requireNext(args, i++, "--fsm-config");
                    case "--parallel"   -> options.parallel  = true;
                    case "--plc"        -> options.addPlc(requireNext(args, i++, "--plc"));
                    default -> throw new UsageException("Unknown flag: " + args[i]);
                }
            }
            return options;
        }

        private void addPlc(String plcArg) {
            int eq = plcArg.indexOf('=');
            if (eq <= 0 || eq == plcArg.length() - 1) {
                throw new UsageException("--plc expects <name>=<file>, got: " + plcArg);
            }
            String name = plcArg.substring(0, eq);
            if (plcs.containsKey(name)) {
                throw new UsageException("Duplicate PLC name: " + name);
            }
            plcs.put(name, plcArg.substring(eq + 1));
        }

        Path fsmConfigPath() {
            return fsmConfig != null ? Paths.get(fsmConfig) : null;
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
