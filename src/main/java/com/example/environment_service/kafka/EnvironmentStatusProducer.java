package com.example.environment_service.kafka;

import com.example.environment_service.dto.EnvironmentStatusEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class EnvironmentStatusProducer {

    private final KafkaTemplate<String, EnvironmentStatusEvent> statusKafkaTemplate;

    public void sendStatus(EnvironmentStatusEvent event) {
        String key = event.getEnvironmentId() != null ? event.getEnvironmentId() : event.getIdentity();
        log.info("Sending status event: environmentId={}, identity={}, state={}",
                event.getEnvironmentId(), event.getIdentity(), event.getState());
        statusKafkaTemplate.send(KafkaTopics.STATUS_EVENTS, key, event);
    }
}
