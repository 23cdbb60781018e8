package com.asyncreview.dispatch.api;

import com.asyncreview.core.model.ConversationTurn;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SuggestionsRequest(
    List<ConversationTurn> conversation,
    @JsonProperty("last_answer") String lastAnswer
) {}
