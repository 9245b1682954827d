package com.arkham.logging.event;

import java.util.Locale;

/**
 * Result of an operation described by a {@link WideEvent}.
 */
public enum Outcome {
    SUCCESS,
    ERROR;

    /**
     * Returns the serialized form: {@code success} or {@code error}.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
