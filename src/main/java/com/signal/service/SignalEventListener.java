package com.signal.service;

import com.signal.model.Signal;

/**
 * Receives signal lifecycle events from {@link SignalEngine}.
 *
 * <p>Created events are delivered on the tick-processing thread while the engine lock is
 * held, so implementations must return quickly and hand slow work (network delivery) off.
 */
public interface SignalEventListener {

    default void onSignalCreated(Signal signal) {
    }

    default void onSignalResolved(Signal signal) {
    }
}
