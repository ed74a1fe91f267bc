package fr.imt.pbdeployer.infrastructure.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.imt.pbdeployer.business.model.ProgressEvent;
import fr.imt.pbdeployer.business.port.ProgressPublisherPort;
import fr.imt.pbdeployer.configuration.RedisConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class RedisProgressPublisherAdapter implements ProgressPublisherPort {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void publish(String subscription, ProgressEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(new ProgressMessage(subscription, event));
            redisTemplate.convertAndSend(RedisConfiguration.PROGRESS_TOPIC, payload);
        } catch (JsonProcessingException | DataAccessException e) {
            log.error("[PROGRESS] Failed to publish {} event of {}", event.getStep(), subscription, e);
        }
    }
}
