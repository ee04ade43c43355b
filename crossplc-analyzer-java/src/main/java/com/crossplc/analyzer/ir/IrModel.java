package com.crossplc.analyzer.ir;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * POJOs for the vendor-neutral PLC intermediate representation.
 * Field names use @SerializedName for JSON snake_case mapping.
 *
 * Front-ends populate these objects once. Analysis passes only read them, except for
 * {@link IrController#fsm}, which is set by the FSM attach phase.
 */
public final class IrModel {

    private IrModel() {}

    public enum SourceType {
        @SerializedName("L5X")     L5X,
        @SerializedName("OpenPLC") OPENPLC,
        @SerializedName("Siemens") SIEMENS,
        @SerializedName("LAD")     LAD,
        @SerializedName("TXT")     TXT
    }

    public enum RoutineType {
        @SerializedName("ST")  ST,
        @SerializedName("RLL") RLL,
        @SerializedName("FBD") FBD,
        @SerializedName("LAD") LAD
    }

    public enum TagScope {
        @SerializedName("controller") CONTROLLER,
        @SerializedName("program")    PROGRAM;

        public String label() {
            return this == CONTROLLER ? "controller" : "program";
        }
    }

    public static class IrProject {
        @SerializedName("controller") public IrController controller;
        @SerializedName("programs")   public List<IrProgram> programs = new ArrayList<>();
        @SerializedName("tasks")      public List<Map<String, Object>> tasks = new ArrayList<>();
        @SerializedName("modules")    public List<Map<String, Object>> modules = new ArrayList<>();
        @SerializedName("metadata")   public Map<String, Object> metadata = new LinkedHashMap<>();

        /** Every routine of every program, in declaration order. */
        public List<IrRoutine> allRoutines() {
            List<IrRoutine> routines = new ArrayList<>();
            for (IrProgram program : programs) {
                routines.addAll(program.routines);
            }
            return routines;
        }

        public String controllerName() {
            return controller != null ? controller.name : null;
        }
    }

    public static class IrController {
        @SerializedName("name")            public String name;
        @SerializedName("description")     public String description;
        @SerializedName("source_type")     public SourceType sourceType;
        @SerializedName("tags")            public List<IrTag> tags = new ArrayList<>();
        @SerializedName("data_types")      public List<IrDataType> dataTypes = new ArrayList<>();
        @SerializedName("function_blocks") public List<IrFunctionBlock> functionBlocks = new ArrayList<>();
        @SerializedName("fsm")             public IrStateMachine fsm;  // nullable, attached post-hoc
    }

    public static class IrProgram {
        @SerializedName("name")            public String name;
        @SerializedName("description")     public String description;
        @SerializedName("main_routine")    public String mainRoutine;  // nullable
        @SerializedName("routines")        public List<IrRoutine> routines = new ArrayList<>();
        @SerializedName("tags")            public List<IrTag> tags = new ArrayList<>();
        @SerializedName("local_variables") public List<IrTag> localVariables = new ArrayList<>();
    }

    public static class IrRoutine {
        @SerializedName("name")         public String name;
        @SerializedName("routine_type") public RoutineType routineType;
        @SerializedName("content")      public String content;
        @SerializedName("description")  public String description;

        public boolean hasContent() {
            return content != null && !content.isBlank();
        }
    }

    public static class IrTag {
        @SerializedName("name")             public String name;
        @SerializedName("data_type")        public String dataType;  // open vocabulary
        @SerializedName("scope")            public TagScope scope;
        @SerializedName("value")            public String value;
        @SerializedName("initial_value")    public String initialValue;
        @SerializedName("description")      public String description;
        @SerializedName("external_access")  public String externalAccess;
        @SerializedName("radix")            public String radix;
        @SerializedName("constant")         public boolean constant;
        @SerializedName("alias_for")        public String aliasFor;
        @SerializedName("array_dimensions") public List<Integer> arrayDimensions;

        public boolean isArray() {
            return arrayDimensions != null && !arrayDimensions.isEmpty();
        }
    }

    public static class IrDataType {
        @SerializedName("name")        public String name;
        @SerializedName("description") public String description;
        @SerializedName("members")     public List<IrTag> members = new ArrayList<>();
    }

    public static class IrFunctionBlock {
        @SerializedName("name")        public String name;
        @SerializedName("description") public String description;
        @SerializedName("inputs")      public List<IrTag> inputs = new ArrayList<>();
        @SerializedName("outputs")     public List<IrTag> outputs = new ArrayList<>();
        @SerializedName("locals")      public List<IrTag> locals = new ArrayList<>();
        @SerializedName("content")     public String content;
    }

    public static class FsmState {
        @SerializedName("name")        public String name;
        @SerializedName("description") public String description;
        @SerializedName("is_initial")  public boolean isInitial;
        @SerializedName("is_final")    public boolean isFinal;
    }

    public static class FsmTransition {
        /** Source placeholder used until a real predecessor is known. */
        public static final String UNKNOWN_STATE = "UNKNOWN";
        public static final String CURRENT_STATE = "CURRENT_STATE";

        @SerializedName("from_state") public String fromState;
        @SerializedName("to_state")   public String toState;
        @SerializedName("guard")      public String guard;
        @SerializedName("actions")    public List<String> actions = new ArrayList<>();
    }

    public static class IrStateMachine {
        @SerializedName("name")           public String name;
        @SerializedName("state_variable") public String stateVariable;
        @SerializedName("description")    public String description;
        @SerializedName("source_type")    public SourceType sourceType;
        @SerializedName("states")         public List<FsmState> states = new ArrayList<>();
        @SerializedName("transitions")    public List<FsmTransition> transitions = new ArrayList<>();
        @SerializedName("is_implicit")    public boolean isImplicit;
    }
}
