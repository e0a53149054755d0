package com.subledger.engine;

import java.util.Objects;

/**
 * A diagnostic attached to a run. Diagnostics never change what the run computes; they point at
 * the trade, deal or position they concern through {@code subject}.
 */
public final class SubledgerMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String subject;

    public SubledgerMessage(Level level, String message, String subject) {
        this.level = Objects.requireNonNull(level, "level");
        this.message = Objects.requireNonNull(message, "message");
        this.subject = subject;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSubject() {
        return subject;
    }

    @Override
    public String toString() {
        return level + (subject != null ? " [" + subject + "] " : " ") + message;
    }
}
