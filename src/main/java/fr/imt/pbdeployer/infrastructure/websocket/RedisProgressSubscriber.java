package fr.imt.pbdeployer.infrastructure.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.imt.pbdeployer.infrastructure.redis.ProgressMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class RedisProgressSubscriber {

    public static final String DESTINATION_PREFIX = "/topic/progress/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    public RedisProgressSubscriber(SimpMessagingTemplate messagingTemplate, ObjectMapper objectMapper) {
        this.messagingTemplate = messagingTemplate;
        this.objectMapper = objectMapper;
    }

    public void onMessage(String messageBody) {
        ProgressMessage message;
        try {
            message = objectMapper.readValue(messageBody, ProgressMessage.class);
        } catch (JsonProcessingException e) {
            log.error("[PROGRESS] Dropping unreadable progress message", e);
            return;
        }
        if (message.subscription() == null || message.event() == null) {
            log.warn("[PROGRESS] Dropping progress message without subscription or event");
            return;
        }
        log.debug("[PROGRESS] {} {} {}%", message.subscription(), message.event().getStep(),
                message.event().getProgressPercent());
        messagingTemplate.convertAndSend(DESTINATION_PREFIX + message.subscription(), message.event());
    }
}
