package com.dflow.engine.event;

import com.dflow.protocol.event.ExecutionEvent;
import com.dflow.protocol.event.ExecutionEventListener;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EventDispatcherTest {

    @Test
    void dispatch_deliversInRegistrationOrder() {
        List<String> seen = new ArrayList<>();
        EventDispatcher dispatcher = new EventDispatcher(List.of(
                e -> seen.add("first:" + e.getRunId()),
                e -> seen.add("second:" + e.getRunId())));

        dispatcher.dispatch(ExecutionEvent.runStarted("r1"));

        assertEquals(List.of("first:r1", "second:r1"), seen);
    }

    @Test
    void dispatch_failingListenerDoesNotStopOthers() {
        List<String> seen = new ArrayList<>();
        EventDispatcher dispatcher = new EventDispatcher();
        dispatcher.addListener(e -> {
            throw new IllegalStateException("listener down");
        });
        dispatcher.addListener(e -> seen.add(e.getType().name()));

        dispatcher.dispatch(ExecutionEvent.runCompleted("r1", "SUCCEEDED", 0, 5));

        assertEquals(List.of("RUN_COMPLETED"), seen);
    }

    @Test
    void removeListener_stopsDelivery() {
        List<String> seen = new ArrayList<>();
        EventDispatcher dispatcher = new EventDispatcher();
        ExecutionEventListener listener = e -> seen.add("x");
        dispatcher.addListener(listener);
        dispatcher.removeListener(listener);

        dispatcher.dispatch(ExecutionEvent.runStarted("r1"));

        assertEquals(List.of(), seen);
    }
}
