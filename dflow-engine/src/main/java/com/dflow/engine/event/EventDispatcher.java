package com.dflow.engine.event;

import com.dflow.protocol.event.ExecutionEvent;
import com.dflow.protocol.event.ExecutionEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans execution events out to listeners in registration order. A listener that throws is logged and
 * skipped; the run carries on.
 */
public final class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<ExecutionEventListener> listeners = new CopyOnWriteArrayList<>();

    public EventDispatcher() {
    }

    public EventDispatcher(List<ExecutionEventListener> listeners) {
        if (listeners != null) listeners.forEach(this::addListener);
    }

    public void addListener(ExecutionEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ExecutionEventListener listener) {
        listeners.remove(listener);
    }

    public void dispatch(ExecutionEvent event) {
        for (ExecutionEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed | event={} | listener={} | error={}",
                        event.getType(), listener.getClass().getName(), e.toString(), e);
            }
        }
    }
}
