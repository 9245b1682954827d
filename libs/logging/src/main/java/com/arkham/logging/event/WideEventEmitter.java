package com.arkham.logging.event;

/**
 * Destination of wide events the sampler decided to keep.
 */
@FunctionalInterface
public interface WideEventEmitter {

    void emit(WideEvent event);
}
