package com.arkham.orders.domain;

import java.util.Locale;

/** Lifecycle of an order. The reference service only ever confirms. */
public enum OrderStatus {
    CONFIRMED;

    /** Lower-case wire name, as written to responses and wide events. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
