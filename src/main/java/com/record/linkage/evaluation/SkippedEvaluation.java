package com.record.linkage.evaluation;

import com.record.linkage.core.model.AlgorithmType;

/**
 * An algorithm left out of a report, with the reason.
 */
public record SkippedEvaluation(AlgorithmType algorithm, SkipReason reason, String message) {
}
