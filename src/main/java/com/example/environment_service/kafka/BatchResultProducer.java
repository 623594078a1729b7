package com.example.environment_service.kafka;

import com.example.environment_service.dto.BatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class BatchResultProducer {

    private final KafkaTemplate<String, BatchResult> batchResultKafkaTemplate;

    public void sendResult(BatchResult result) {
        log.info("Sending batch result: prefix={}, succeeded={}, failed={}, cancelled={}",
                result.getNamePrefix(), result.getSucceeded(), result.getFailed(), result.getCancelled());
        batchResultKafkaTemplate.send(KafkaTopics.BATCH_RESULTS, result.getNamePrefix(), result);
    }
}
