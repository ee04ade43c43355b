package com.crossplc.analyzer.analysis;

import com.crossplc.analyzer.fsm.CrossControllerFsm;
import com.crossplc.analyzer.multi_plc.ConflictingTag;
import com.crossplc.analyzer.multi_plc.CrossPlcDependency;
import com.crossplc.analyzer.multi_plc.MultiPlcAnalyzer.MultiPlcSummary;
import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Aggregate result of analyzing several controllers together.
 */
public record MultiPlcReport(
    @SerializedName("summary")               MultiPlcSummary summary,
    @SerializedName("cross_plc_dependencies") List<CrossPlcDependency> dependencies,
    @SerializedName("conflicting_tags")      List<ConflictingTag> conflicts,
    @SerializedName("composite_fsm")         CrossControllerFsm compositeFsm
) {}
