package com.jreinhal.norma.model;

import java.util.List;

/**
 * One prior exchange in the chat session, as handed over by the session layer.
 */
public record ConversationTurn(String role, String content) {

    public boolean isUser() {
        return "user".equalsIgnoreCase(this.role);
    }

    /**
     * The last {@code maxTurns} entries, oldest first. Null-safe.
     */
    public static List<ConversationTurn> lastTurns(List<ConversationTurn> history, int maxTurns) {
        if (history == null || history.isEmpty() || maxTurns <= 0) {
            return List.of();
        }
        int from = Math.max(0, history.size() - maxTurns);
        return List.copyOf(history.subList(from, history.size()));
    }

    public static String format(List<ConversationTurn> turns) {
        if (turns == null || turns.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (ConversationTurn turn : turns) {
            if (turn == null || turn.content() == null) {
                continue;
            }
            sb.append(turn.isUser() ? "Utente: " : "Assistente: ").append(turn.content().trim()).append('\n');
        }
        return sb.toString().trim();
    }
}
