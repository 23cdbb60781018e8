package com.asyncreview.core.model;

/**
 * One message of a prior conversation.
 *
 * @param role    "user" or "assistant"
 * @param content message text
 */
public record ConversationTurn(
    String role,
    String content
) {
    public static ConversationTurn user(String content) {
        return new ConversationTurn("user", content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn("assistant", content);
    }
}
