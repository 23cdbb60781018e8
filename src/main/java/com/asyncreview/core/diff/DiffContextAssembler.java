package com.asyncreview.core.diff;

import com.asyncreview.core.model.DiffFileContext;

import java.util.List;

/**
 * Turns a list of changed files into a single text context for the model. Every file's
 * path, status and stats appear in a metadata preamble, whatever the per-file rendering.
 */
public interface DiffContextAssembler {

    DiffContext assemble(List<DiffFileContext> files);
}
