package com.example.environment_service.kafka;

import com.example.environment_service.dto.ResourceAlert;
import com.example.environment_service.model.PressureLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ResourceAlertProducerTest {

    @Mock
    private KafkaTemplate<String, ResourceAlert> alertKafkaTemplate;

    @InjectMocks
    private ResourceAlertProducer producer;

    @Test
    void sendAlert_publishesOnAlertTopic() {
        ResourceAlert alert = ResourceAlert.builder()
                .category(ResourceAlert.Category.QUOTA_PRESSURE)
                .severity(PressureLevel.CRITICAL)
                .environmentId("e-1")
                .namespace("env-alice")
                .build();

        producer.sendAlert(alert);

        verify(alertKafkaTemplate).send(KafkaTopics.ALERTS, "e-1", alert);
    }
}
