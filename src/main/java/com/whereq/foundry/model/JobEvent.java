package com.whereq.foundry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * One element of a job's live event stream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobEvent {

    private Type type;

    /**
     * Output line for OUTPUT events, a message otherwise
     */
    private String payload;

    /**
     * Progress at the time the event was published
     */
    private double progress;

    private Instant timestamp;

    public static JobEvent output(String line, double progress, Instant at) {
        return new JobEvent(Type.OUTPUT, line, progress, at);
    }

    public static JobEvent terminal(Type type, String message, double progress, Instant at) {
        if (type == Type.OUTPUT) {
            throw new IllegalArgumentException("OUTPUT is not a terminal event type");
        }
        return new JobEvent(type, message, progress, at);
    }

    public boolean isTerminal() {
        return type != Type.OUTPUT;
    }

    public enum Type {
        OUTPUT,
        COMPLETED,
        FAILED,
        CANCELLED,
        /**
         * Output could not be monitored
         */
        ERROR;

        public String eventName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
