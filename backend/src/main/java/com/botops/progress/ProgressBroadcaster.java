package com.botops.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans campaign progress out to server-sent-event subscribers of the same tenant.
 * Delivery is best effort; emitters that fail are dropped.
 */
@Component
public class ProgressBroadcaster implements ProgressPublisher {

    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);
    private static final long EMITTER_TIMEOUT_MS = 30 * 60 * 1000L;

    private final Map<String, List<SseEmitter>> subscribers = new ConcurrentHashMap<>();

    public SseEmitter subscribe(String tenantId) {
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        // add inside the map operation so a concurrent remove of the last emitter cannot orphan the list
        subscribers.compute(tenantId, (key, emitters) -> {
            List<SseEmitter> tenantEmitters = emitters == null ? new CopyOnWriteArrayList<>() : emitters;
            tenantEmitters.add(emitter);
            return tenantEmitters;
        });

        emitter.onCompletion(() -> remove(tenantId, emitter));
        emitter.onTimeout(() -> {
            remove(tenantId, emitter);
            emitter.complete();
        });
        emitter.onError(error -> remove(tenantId, emitter));
        return emitter;
    }

    @Override
    public void publish(CampaignProgressEvent event) {
        List<SseEmitter> tenantEmitters = subscribers.get(event.tenantId());
        if (tenantEmitters == null || tenantEmitters.isEmpty()) {
            return;
        }

        for (SseEmitter emitter : tenantEmitters) {
            try {
                emitter.send(SseEmitter.event().name(event.type()).data(event));
            } catch (IOException | IllegalStateException ex) {
                log.debug("Dropping progress subscriber for tenant {}: {}", event.tenantId(), ex.getMessage());
                remove(event.tenantId(), emitter);
            }
        }
    }

    int subscriberCount(String tenantId) {
        List<SseEmitter> tenantEmitters = subscribers.get(tenantId);
        return tenantEmitters == null ? 0 : tenantEmitters.size();
    }

    private void remove(String tenantId, SseEmitter emitter) {
        subscribers.computeIfPresent(tenantId, (key, emitters) -> {
            emitters.remove(emitter);
            return emitters.isEmpty() ? null : emitters;
        });
    }
}
