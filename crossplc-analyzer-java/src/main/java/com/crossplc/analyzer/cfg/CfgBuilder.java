package com.crossplc.analyzer.cfg;

import com.crossplc.analyzer.ir.IrModel.IrProgram;
import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrModel.IrRoutine;
import com.crossplc.analyzer.text.LineClassifier;
import com.crossplc.analyzer.text.LineClassifier.ClassifiedLine;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Partitions routine text into basic blocks.
 *
 * Block ids come from a counter owned by this builder, so ids are unique across every
 * routine built by the same instance and restart for a new instance. Only one control
 * block is open at a time: nested constructs produce a flattened graph.
 *
 * An opening control line always starts a new block, even when the block it ends holds
 * no instructions. The entry block and the join block after each closed construct are
 * therefore kept when empty, so every construct yields a control block followed by its
 * join block and a routine starting with IF still has an empty {@code entry}.
 */
public class CfgBuilder {

    public static final String ENTRY = "entry";
    static final String BLOCK_PREFIX = "block_";

    private int blockCounter = 0;

    /**
     * Builds every routine of the project, keyed by routine name. Routines without content
     * are omitted; routines without a name are skipped with a warning.
     */
    public Map<String, RoutineCfg> buildAll(IrProject project) {
        Map<String, RoutineCfg> cfgs = new LinkedHashMap<>();
        for (IrProgram program : project.programs) {
            for (IrRoutine routine : program.routines) {
                if (!routine.hasContent()) continue;
                if (routine.name == null || routine.name.isBlank()) {
                    System.err.println("[crossplc] WARNING: unnamed routine ignored in program " + program.name);
                    continue;
                }
                if (cfgs.containsKey(routine.name)) {
                    System.err.println("[crossplc] WARNING: duplicate routine name ignored: "
                            + program.name + "." + routine.name);
                    continue;
                }
                build(routine, program.name).ifPresent(cfg -> cfgs.put(routine.name, cfg));
            }
        }
        return cfgs;
    }

    public Optional<RoutineCfg> build(IrRoutine routine) {
        return build(routine, null);
    }

    public Optional<RoutineCfg> build(IrRoutine routine, String programName) {
        if (routine == null || !routine.hasContent()) {
            return Optional.empty();
        }

        List<BasicBlock> blocks = new ArrayList<>();
        // control block -> join block allocated when the construct closed
        Map<BasicBlock, String> closeLinks = new IdentityHashMap<>();

        BasicBlock current = new BasicBlock(ENTRY, BasicBlock.Kind.BASIC);
        blocks.add(current);
        BasicBlock openControl = null;

        for (String rawLine : routine.content.split("\\R")) {
            ClassifiedLine line = LineClassifier.classify(rawLine);
            if (line.isSkippable()) continue;

            switch (line.kind()) {
                case CONTROL_OPEN -> {
                    BasicBlock control = new BasicBlock(nextId(), kindOf(line.keyword()));
                    control.condition = line.condition();
                    if (control.kind == BasicBlock.Kind.BRANCH) {
                        control.trueSuccessor = peekId(1);
                        control.falseSuccessor = peekId(2);
                    }
                    if (!line.body().isEmpty()) {
                        control.instructions.add(line.body());
                    }
                    blocks.add(control);
                    current = control;
                    openControl = control;
                    if (line.closedInline()) {
                        current = closeControl(blocks, closeLinks, openControl, current);
                        openControl = null;
                    }
                }
                case CONTROL_CLOSE -> {
                    current = closeControl(blocks, closeLinks, openControl, current);
                    openControl = null;
                }
                default -> current.instructions.add(line.text());
            }
        }

        linkBlocks(blocks, closeLinks);
        String type = routine.routineType != null ? routine.routineType.name() : null;
        return Optional.of(new RoutineCfg(routine.name, programName, type, blocks));
    }

    /**
     * Ends the open control construct and returns the block that accumulates what follows.
     * A close line with nothing open only starts a new block when the current one holds
     * instructions.
     */
    private BasicBlock closeControl(List<BasicBlock> blocks, Map<BasicBlock, String> closeLinks,
                                    BasicBlock openControl, BasicBlock current) {
        if (openControl == null && current.isEmpty()) {
            return current;
        }
        BasicBlock next = new BasicBlock(nextId(), BasicBlock.Kind.BASIC);
        if (openControl != null) {
            closeLinks.put(openControl, next.id);
        }
        blocks.add(next);
        return next;
    }

    private void linkBlocks(List<BasicBlock> blocks, Map<BasicBlock, String> closeLinks) {
        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            if (block.kind == BasicBlock.Kind.BRANCH) {
                block.addSuccessor(block.trueSuccessor);
                block.addSuccessor(block.falseSuccessor);
            } else if (i + 1 < blocks.size()) {
                block.addSuccessor(blocks.get(i + 1).id);
            }
            block.addSuccessor(closeLinks.get(block));
        }
    }

    private static BasicBlock.Kind kindOf(String keyword) {
        return switch (keyword) {
            case "IF" -> BasicBlock.Kind.BRANCH;
            case "CASE" -> BasicBlock.Kind.SWITCH;
            default -> BasicBlock.Kind.LOOP;
        };
    }

    private String nextId() {
        return BLOCK_PREFIX + (++blockCounter);
    }

    private String peekId(int ahead) {
        return BLOCK_PREFIX + (blockCounter + ahead);
    }

    /** Number of ids handed out so far by this builder. */
    public int allocatedBlocks() {
        return blockCounter;
    }
}
