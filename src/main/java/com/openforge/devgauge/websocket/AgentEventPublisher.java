package com.openforge.devgauge.websocket;

import com.openforge.devgauge.agent.event.AgentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Routes {@link AgentEvent}s to the STOMP topic of their session.
 *
 * Topic layout:
 *   /topic/agent/{sessionId}  all events for one session
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentEventPublisher {

    public static final String TOPIC_PREFIX = "/topic/agent/";

    private final SimpMessagingTemplate messagingTemplate;

    public static String topic(String sessionId) {
        return TOPIC_PREFIX + sessionId;
    }

    /** Delivery failures are logged and dropped; they never fail the model call. */
    public void publish(AgentEvent event) {
        String destination = topic(event.sessionId());
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }

    /** Token sink for one operation: each fragment becomes a TOKEN event. */
    public Consumer<String> tokenSink(String sessionId, String operation) {
        return fragment -> publish(AgentEvent.token(sessionId, operation, fragment));
    }
}
