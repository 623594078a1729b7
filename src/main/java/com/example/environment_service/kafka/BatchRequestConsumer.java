package com.example.environment_service.kafka;

import com.example.environment_service.dto.BatchJobRequest;
import com.example.environment_service.service.EnvironmentRequestHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class BatchRequestConsumer {

    private final EnvironmentRequestHandler requestHandler;

    @KafkaListener(
            topics = KafkaTopics.BATCH_REQUESTS,
            groupId = KafkaTopics.GROUP_ID,
            containerFactory = "batchKafkaListenerContainerFactory"
    )
    public void consumeBatchRequest(BatchJobRequest job) {
        log.info("📨 Received batch request: operation={}, prefix={}, count={}, mode={}",
                job.getOperation(), job.getNamePrefix(), job.getCount(), job.getMode());

        try {
            requestHandler.handleBatchRequest(job);
        } catch (Exception e) {
            log.error("❌ Failed to process batch request: {}", e.getMessage(), e);
        }
    }
}
