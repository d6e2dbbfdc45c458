package com.phonepe.agentrecall.core.events;

import com.google.common.annotations.VisibleForTesting;
import io.appform.signals.signals.ConsumingFireForgetSignal;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Side channel on which lifecycle, audit and recall events are published
 */
public class EventBus {
    private final ConsumingFireForgetSignal<LifecycleEvent> eventSignal;

    /**
     * Create event bus with default cached thread pool executor service
     */
    public EventBus() {
        this(Executors.newCachedThreadPool());
    }

    /**
     * Create event bus with custom executor service
     * @param executorService The executor service to use for handling events
     */
    public EventBus(final ExecutorService executorService) {
        this(ConsumingFireForgetSignal.<LifecycleEvent>builder()
                     .executorService(executorService)
                     .build());
    }

    @VisibleForTesting
    EventBus(ConsumingFireForgetSignal<LifecycleEvent> eventSignal) {
        this.eventSignal = eventSignal;
    }

    /**
     * @return The signal to listen to events. Use Signal.connect to connect event handlers.
     */
    public ConsumingFireForgetSignal<LifecycleEvent> onEvent() {
        return eventSignal;
    }

    public void notify(final LifecycleEvent event) {
        eventSignal.dispatch(event);
    }
}
