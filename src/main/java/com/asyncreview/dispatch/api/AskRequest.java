package com.asyncreview.dispatch.api;

import com.asyncreview.core.model.ConversationTurn;
import com.asyncreview.core.model.DiffSelection;

import java.util.List;

/**
 * Inbound JSON body for the ask endpoints.
 *
 * @param question     the question; required
 * @param conversation prior turns, oldest first; nullable
 * @param selection    the user's selection in the diff; nullable
 */
public record AskRequest(
    String question,
    List<ConversationTurn> conversation,
    DiffSelection selection
) {}
