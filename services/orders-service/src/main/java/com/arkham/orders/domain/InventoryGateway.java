package com.arkham.orders.domain;

/**
 * Port to the inventory system.
 *
 * <p>Implementations are wrapped by {@code ServiceCallLogging}, so each call is recorded as a
 * wide event named {@code InventoryGateway.<method>}.
 */
public interface InventoryGateway {

    /** Units currently available for {@code sku}. */
    int available(String sku);

    /**
     * Reserves {@code quantity} units of {@code sku}.
     *
     * @return true when the units were reserved, false when stock is short
     */
    boolean reserve(String sku, int quantity);
}
