package com.openforge.fleetcore.websocket;

import com.openforge.fleetcore.event.ResearchEvent;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ResearchEventPublisherTest {

    private final SimpMessagingTemplate  template  = mock(SimpMessagingTemplate.class);
    private final ResearchEventPublisher publisher = new ResearchEventPublisher(template);

    @Test
    void eventsGoToTheRunTopic() {
        ResearchEvent event = ResearchEvent.iterationStart("run-42", 1);

        publisher.publish(event);

        verify(template).convertAndSend("/topic/research/run-42", event);
    }

    @Test
    void deliveryFailuresDoNotPropagate() {
        doThrow(new MessageDeliveryException("broker unavailable"))
                .when(template).convertAndSend(eq("/topic/research/run-42"), any(Object.class));

        assertThatCode(() -> publisher.publish(ResearchEvent.completed("run-42", "Profile complete", 1)))
                .doesNotThrowAnyException();
    }
}
