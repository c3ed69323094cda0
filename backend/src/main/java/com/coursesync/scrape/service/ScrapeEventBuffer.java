package com.coursesync.scrape.service;

import com.coursesync.scrape.model.AuditLogEvent;
import com.coursesync.scrape.model.ScrapeJobEvent;
import com.coursesync.scrape.model.ScrapeResultEvent;
import com.coursesync.scrape.model.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Bounded replay ring of recent scrape events, plus fan-out to live stream subscribers.
 */
@Component
public class ScrapeEventBuffer {
    private static final Logger log = LoggerFactory.getLogger(ScrapeEventBuffer.class);
    static final int CAPACITY = 500;

    private final Clock clock;
    private final Deque<StreamEvent> events = new ArrayDeque<>();
    private final List<Consumer<StreamEvent>> subscribers = new CopyOnWriteArrayList<>();
    private long sequence;

    public ScrapeEventBuffer(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    public void onJobEvent(ScrapeJobEvent event) {
        append("job." + event.type().name().toLowerCase(Locale.ROOT), event);
    }

    @EventListener
    public void onResultEvent(ScrapeResultEvent event) {
        append("result", event.result());
    }

    @EventListener
    public void onAuditEvent(AuditLogEvent event) {
        append("audit", event);
    }

    public List<StreamEvent> recent(int limit) {
        int safeLimit = Math.max(1, Math.min(limit, CAPACITY));
        List<StreamEvent> copy;
        synchronized (events) {
            copy = new ArrayList<>(events);
        }
        int from = Math.max(0, copy.size() - safeLimit);
        return copy.subList(from, copy.size());
    }

    public Runnable subscribe(Consumer<StreamEvent> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    private void append(String type, Object payload) {
        StreamEvent event;
        synchronized (events) {
            event = new StreamEvent(++sequence, type, clock.instant(), payload);
            events.addLast(event);
            while (events.size() > CAPACITY) {
                events.removeFirst();
            }
        }
        for (Consumer<StreamEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.debug("Dropping event subscriber after delivery failure: {}", e.getMessage());
                subscribers.remove(subscriber);
            }
        }
    }
}
