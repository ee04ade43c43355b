package com.crossplc.analyzer.fsm;

import com.crossplc.analyzer.config.FsmConfig;
import com.crossplc.analyzer.ir.IrModel.FsmTransition;
import com.crossplc.analyzer.ir.IrModel.IrProject;
import com.crossplc.analyzer.ir.IrModel.IrStateMachine;
import com.crossplc.analyzer.ir.IrModel.IrTag;
import com.crossplc.analyzer.text.TagExtractor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Runs {@link FsmExtractor} on every controller and links transitions of different
 * controllers that touch the same controller tag.
 *
 * <p>Extraction does not modify the projects; {@link #attachStateMachines} does, as a
 * separate step.
 */
public class CrossControllerFsmExtractor {

    static final String COMPOSITE_NAME = "Composite_FSM";

    private final Function<String, FsmConfig> configForController;

    public CrossControllerFsmExtractor() {
        this(name -> FsmConfig.empty());
    }

    /** @param configForController controller name -> hints for that controller */
    public CrossControllerFsmExtractor(Function<String, FsmConfig> configForController) {
        this.configForController = configForController;
    }

    /**
     * Keys each project by its controller name. A name already taken by an earlier project
     * gets its 1-based position appended ({@code PLC#2}), so projects sharing a controller
     * name keep separate FSMs.
     */
    public CrossControllerFsm extract(List<IrProject> projects) {
        return extract(keyByController(projects));
    }

    /**
     * @param plcs PLC name -> project; the PLC name keys {@code controllers} and
     *             {@code controllerFsms}, the controller name selects the config
     */
    public CrossControllerFsm extract(Map<String, IrProject> plcs) {
        List<String> controllers = new ArrayList<>();
        Map<String, IrStateMachine> controllerFsms = new LinkedHashMap<>();
        Set<String> sharedTags = new LinkedHashSet<>();

        for (Map.Entry<String, IrProject> entry : plcs.entrySet()) {
            IrProject project = entry.getValue();
            if (project.controller == null) continue;
            String key = entry.getKey();
            controllers.add(key);
            new FsmExtractor(configForController.apply(project.controller.name))
                .extractStateMachine(project)
                .ifPresent(fsm -> controllerFsms.put(key, fsm));
            for (IrTag tag : project.controller.tags) {
                if (tag.name != null) sharedTags.add(tag.name);
            }
        }

        List<LinkedTransition> linked = findLinkedTransitions(new ArrayList<>(controllerFsms.values()), sharedTags);
        return new CrossControllerFsm(
            COMPOSITE_NAME,
            "Composite FSM across multiple controllers",
            controllers,
            controllerFsms,
            new ArrayList<>(sharedTags),
            linked);
    }

    /** Sets each controller's {@code fsm} from a previous {@link #extract(List)} result. */
    public void attachStateMachines(List<IrProject> projects, CrossControllerFsm result) {
        attachStateMachines(keyByController(projects), result);
    }

    /** Sets each controller's {@code fsm} from a previous {@link #extract(Map)} result. */
    public void attachStateMachines(Map<String, IrProject> plcs, CrossControllerFsm result) {
        for (Map.Entry<String, IrProject> entry : plcs.entrySet()) {
            IrProject project = entry.getValue();
            if (project.controller == null) continue;
            IrStateMachine fsm = result.controllerFsms().get(entry.getKey());
            if (fsm != null) {
                project.controller.fsm = fsm;
            }
        }
    }

    private static Map<String, IrProject> keyByController(List<IrProject> projects) {
        Map<String, IrProject> keyed = new LinkedHashMap<>();
        for (int i = 0; i < projects.size(); i++) {
            IrProject project = projects.get(i);
            if (project.controller == null) continue;
            String key = project.controller.name;
            if (keyed.containsKey(key)) {
                key = key + "#" + (i + 1);
            }
            keyed.put(key, project);
        }
        return keyed;
    }

    /** One record per linked transition pair, over every ordered pair of distinct FSMs. */
    static List<LinkedTransition> findLinkedTransitions(List<IrStateMachine> fsms, Set<String> sharedTags) {
        List<LinkedTransition> linked = new ArrayList<>();
        for (int i = 0; i < fsms.size(); i++) {
            for (int j = 0; j < fsms.size(); j++) {
                if (i == j) continue;
                IrStateMachine fsm1 = fsms.get(i);
                IrStateMachine fsm2 = fsms.get(j);
                for (FsmTransition t1 : fsm1.transitions) {
                    for (FsmTransition t2 : fsm2.transitions) {
                        Set<String> common = identifiersOf(t1);
                        common.retainAll(identifiersOf(t2));
                        common.retainAll(sharedTags);
                        if (!common.isEmpty()) {
                            linked.add(new LinkedTransition(
                                fsm1.name, fsm2.name, t1.toState, t2.toState, new ArrayList<>(common)));
                        }
                    }
                }
            }
        }
        return linked;
    }

    private static Set<String> identifiersOf(FsmTransition transition) {
        Set<String> identifiers = new LinkedHashSet<>();
        if (transition.guard != null) {
            identifiers.addAll(TagExtractor.extractIdentifiers(transition.guard));
        }
        for (String action : transition.actions) {
            identifiers.addAll(TagExtractor.extractIdentifiers(action));
        }
        return identifiers;
    }
}
