package com.phillippitts.meetingscribe.testutil;

import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Records failure events published from dispatcher and worker threads.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {

    private final Queue<Object> published = new ConcurrentLinkedQueue<>();

    @Override
    public void publishEvent(Object event) {
        published.add(event);
    }

    public <T> List<T> eventsOfType(Class<T> type) {
        return published.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
