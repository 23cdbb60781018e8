package com.asyncreview.core.engine;

import com.asyncreview.core.model.IterationRecord;

/**
 * Receives each round as soon as it completes.
 */
@FunctionalInterface
public interface IterationListener {

    IterationListener NONE = record -> {};

    void onIteration(IterationRecord record);
}
