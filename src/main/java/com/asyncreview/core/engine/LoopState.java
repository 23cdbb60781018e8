package com.asyncreview.core.engine;

/**
 * States of one reasoning run. {@code DONE} and {@code EXHAUSTED} both lead to
 * {@code TERMINATED}; no state is revisited after it.
 */
public enum LoopState {
    INIT,
    ITERATING,
    DONE,
    EXHAUSTED,
    TERMINATED
}
