package com.crossplc.analyzer.fsm;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Two transitions of different controllers' FSMs whose guards or actions mention a common
 * controller tag. {@code sharedTags} holds the tags that made the link.
 */
public record LinkedTransition(
    @SerializedName("controller1") String fsm1,
    @SerializedName("controller2") String fsm2,
    @SerializedName("transition1") String toState1,
    @SerializedName("transition2") String toState2,
    @SerializedName("shared_tags") List<String> sharedTags
) {}
