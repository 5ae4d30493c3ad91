package com.interactiveemotes.event;

import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the host when a new in-game day begins. Clears the daily reward ledger.
 */
public class DayStartedEvent extends ApplicationEvent {

    private final LocalDateTime startedAt;

    public DayStartedEvent(Object source) {
        super(source);
        this.startedAt = LocalDateTime.now();
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }
}
