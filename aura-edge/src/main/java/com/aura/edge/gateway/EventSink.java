package com.aura.edge.gateway;

import com.aura.shared.protocol.Event;

/**
 * Where engine events go. Implementations must tolerate calls from more than one thread.
 */
@FunctionalInterface
public interface EventSink {

    void emit(Event event);
}
