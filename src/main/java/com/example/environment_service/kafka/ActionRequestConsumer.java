package com.example.environment_service.kafka;

import com.example.environment_service.dto.EnvironmentActionRequest;
import com.example.environment_service.service.EnvironmentRequestHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class ActionRequestConsumer {

    private final EnvironmentRequestHandler requestHandler;

    @KafkaListener(
            topics = KafkaTopics.ACTION_REQUESTS,
            groupId = KafkaTopics.GROUP_ID,
            containerFactory = "actionKafkaListenerContainerFactory"
    )
    public void consumeActionRequest(EnvironmentActionRequest request) {
        log.info("📥 Received action request: environmentId={}, action={}, force={}",
                request.getEnvironmentId(), request.getAction(), request.isForce());

        if (request.getEnvironmentId() == null || request.getAction() == null) {
            log.warn("⚠️ Ignoring action request without environment id or action");
            return;
        }
        try {
            requestHandler.handleActionRequest(request);
        } catch (Exception e) {
            log.error("❌ Failed to process action request: {}", e.getMessage(), e);
        }
    }
}
