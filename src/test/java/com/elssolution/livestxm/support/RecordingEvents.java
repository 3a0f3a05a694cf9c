package com.elssolution.livestxm.support;

import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Collects published application events. */
public class RecordingEvents implements ApplicationEventPublisher {

    private final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    public <T> List<T> ofType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public void clear() {
        events.clear();
    }
}
