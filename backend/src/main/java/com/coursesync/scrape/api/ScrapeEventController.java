package com.coursesync.scrape.api;

import com.coursesync.scrape.model.StreamEvent;
import com.coursesync.scrape.service.ScrapeEventBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

@RestController
@RequestMapping("/api/scraper/events")
public class ScrapeEventController {
    private static final Logger log = LoggerFactory.getLogger(ScrapeEventController.class);
    private static final long STREAM_TIMEOUT_MS = 30L * 60L * 1000L;

    private final ScrapeEventBuffer eventBuffer;

    public ScrapeEventController(ScrapeEventBuffer eventBuffer) {
        this.eventBuffer = eventBuffer;
    }

    @GetMapping("/recent")
    public List<StreamEvent> recent(@RequestParam(name = "limit", required = false, defaultValue = "100") int limit) {
        return eventBuffer.recent(limit);
    }

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        Runnable unsubscribe = eventBuffer.subscribe(event -> {
            try {
                emitter.send(SseEmitter.event()
                    .id(String.valueOf(event.sequence()))
                    .name(event.type())
                    .data(event, MediaType.APPLICATION_JSON));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        emitter.onCompletion(unsubscribe);
        emitter.onTimeout(() -> {
            unsubscribe.run();
            emitter.complete();
        });
        emitter.onError(error -> {
            log.debug("Event stream closed: {}", error.getMessage());
            unsubscribe.run();
        });
        return emitter;
    }
}
