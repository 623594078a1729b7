package com.example.environment_service.kafka;

import com.example.environment_service.dto.ResourceAlert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class ResourceAlertProducer {

    private final KafkaTemplate<String, ResourceAlert> alertKafkaTemplate;

    public void sendAlert(ResourceAlert alert) {
        log.info("Sending {} alert ({}) for namespace {}", alert.getCategory(), alert.getSeverity(), alert.getNamespace());
        alertKafkaTemplate.send(KafkaTopics.ALERTS, alert.getEnvironmentId(), alert);
    }
}
