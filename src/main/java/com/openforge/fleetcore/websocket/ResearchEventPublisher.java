package com.openforge.fleetcore.websocket;

import com.openforge.fleetcore.event.ResearchEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Routes {@link ResearchEvent}s to the STOMP topic of their run.
 *
 * Topic layout:
 *   /topic/research/{runId}  → all events for one research run
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResearchEventPublisher {

    static final String TOPIC_PREFIX = "/topic/research/";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Fire-and-forget. A delivery failure is logged and never reaches the
     * research loop.
     */
    public void publish(ResearchEvent event) {
        String destination = TOPIC_PREFIX + event.runId();
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }
}
