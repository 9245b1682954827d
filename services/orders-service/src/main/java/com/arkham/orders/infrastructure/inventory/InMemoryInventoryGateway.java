package com.arkham.orders.infrastructure.inventory;

import com.arkham.orders.domain.InventoryGateway;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/** Inventory held in memory; every SKU starts with the same stock level. */
public class InMemoryInventoryGateway implements InventoryGateway {

    private final int initialStock;
    private final Map<String, Integer> stock = new ConcurrentHashMap<>();

    public InMemoryInventoryGateway(int initialStock) {
        if (initialStock < 0) {
            throw new IllegalArgumentException("initialStock must not be negative");
        }
        this.initialStock = initialStock;
    }

    @Override
    public int available(String sku) {
        return stock.getOrDefault(sku, initialStock);
    }

    @Override
    public boolean reserve(String sku, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive");
        }
        var reserved = new AtomicBoolean();
        stock.compute(
                sku,
                (key, current) -> {
                    int level = current == null ? initialStock : current;
                    if (level < quantity) {
                        return level;
                    }
                    reserved.set(true);
                    return level - quantity;
                });
        return reserved.get();
    }
}
