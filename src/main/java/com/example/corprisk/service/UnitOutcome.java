package com.example.corprisk.service;

import com.example.corprisk.model.DimensionResult;
import com.example.corprisk.service.analyzer.Dimension;

/**
 * What one analyzer task hands back to the orchestrator: its result, or the cause it
 * failed with. Tasks never complete exceptionally.
 */
public final class UnitOutcome {

    private final Dimension dimension;
    private final DimensionResult result;
    private final Throwable failure;

    private UnitOutcome(Dimension dimension, DimensionResult result, Throwable failure) {
        this.dimension = dimension;
        this.result = result;
        this.failure = failure;
    }

    public static UnitOutcome completed(Dimension dimension, DimensionResult result) {
        return new UnitOutcome(dimension, result, null);
    }

    public static UnitOutcome failed(Dimension dimension, Throwable cause) {
        return new UnitOutcome(dimension, null, cause);
    }

    public Dimension dimension() {
        return dimension;
    }

    public boolean isCompleted() {
        return failure == null;
    }

    /** The analyzer's own result, or an investigate placeholder carrying the failure message. */
    public DimensionResult toResult() {
        if (isCompleted()) return result;
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return dimension.failed(message);
    }
}
