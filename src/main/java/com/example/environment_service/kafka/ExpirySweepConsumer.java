package com.example.environment_service.kafka;

import com.example.environment_service.dto.ExpirySweepTrigger;
import com.example.environment_service.service.EnvironmentRequestHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Expiry is driven by an external scheduler publishing trigger messages; there is no in-process timer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExpirySweepConsumer {

    private final EnvironmentRequestHandler requestHandler;

    @KafkaListener(
            topics = KafkaTopics.EXPIRY_SWEEP,
            groupId = KafkaTopics.GROUP_ID,
            containerFactory = "sweepKafkaListenerContainerFactory"
    )
    public void consumeSweepTrigger(ExpirySweepTrigger trigger) {
        log.info("⏰ Received expiry sweep trigger: now={}, dryRun={}", trigger.getNow(), trigger.isDryRun());

        try {
            requestHandler.handleExpirySweep(trigger);
        } catch (Exception e) {
            log.error("❌ Failed to process expiry sweep trigger: {}", e.getMessage(), e);
        }
    }
}
