package com.crossplc.analyzer.fsm;

import com.crossplc.analyzer.ir.IrModel.IrStateMachine;
import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

public record CrossControllerFsm(
    @SerializedName("name")               String name,
    @SerializedName("description")        String description,
    @SerializedName("controllers")        List<String> controllers,
    @SerializedName("controller_fsms")    Map<String, IrStateMachine> controllerFsms,
    @SerializedName("shared_tags")        List<String> sharedTags,
    @SerializedName("linked_transitions") List<LinkedTransition> linkedTransitions
) {}
