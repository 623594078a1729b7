package com.example.environment_service.kafka;

import com.example.environment_service.dto.BatchJobRequest;
import com.example.environment_service.dto.BatchOperation;
import com.example.environment_service.dto.BatchResult;
import com.example.environment_service.exception.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BatchResultProducerTest {

    @Mock
    private KafkaTemplate<String, BatchResult> batchResultKafkaTemplate;

    @InjectMocks
    private BatchResultProducer producer;

    @Test
    void sendResult_rejectedJob_isPublishedUnderPrefix() {
        BatchJobRequest job = BatchJobRequest.builder()
                .operation(BatchOperation.CREATE)
                .namePrefix("lab")
                .count(500)
                .build();

        producer.sendResult(BatchResult.rejected(job, ErrorKind.BATCH_TOO_LARGE, "too many"));

        ArgumentCaptor<BatchResult> sent = ArgumentCaptor.forClass(BatchResult.class);
        verify(batchResultKafkaTemplate).send(eq(KafkaTopics.BATCH_RESULTS), eq("lab"), sent.capture());
        assertThat(sent.getValue().getErrorKind()).isEqualTo(ErrorKind.BATCH_TOO_LARGE);
        assertThat(sent.getValue().getItems()).isEmpty();
    }
}
