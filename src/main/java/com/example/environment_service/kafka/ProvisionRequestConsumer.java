package com.example.environment_service.kafka;

import com.example.environment_service.dto.EnvironmentRequest;
import com.example.environment_service.service.EnvironmentRequestHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class ProvisionRequestConsumer {

    private final EnvironmentRequestHandler requestHandler;

    @KafkaListener(
            topics = KafkaTopics.PROVISION_REQUESTS,
            groupId = KafkaTopics.GROUP_ID,
            containerFactory = "provisionKafkaListenerContainerFactory"
    )
    public void consumeProvisionRequest(EnvironmentRequest request) {
        log.info("📨 Received provision request: identity={}, userId={}, templateId={}",
                request.getIdentity(), request.getUserId(), request.getTemplateId());

        try {
            requestHandler.handleProvisionRequest(request);
        } catch (Exception e) {
            log.error("❌ Failed to process provision request: {}", e.getMessage(), e);
        }
    }
}
