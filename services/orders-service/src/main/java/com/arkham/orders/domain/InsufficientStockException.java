package com.arkham.orders.domain;

/** Thrown when inventory cannot cover the requested quantity. */
public class InsufficientStockException extends RuntimeException {

    private final String sku;
    private final int requested;

    public InsufficientStockException(String sku, int requested) {
        super("Insufficient stock for " + sku + ": requested " + requested);
        this.sku = sku;
        this.requested = requested;
    }

    public String getSku() {
        return sku;
    }

    public int getRequested() {
        return requested;
    }
}
