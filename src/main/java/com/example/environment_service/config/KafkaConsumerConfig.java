package com.example.environment_service.config;

import com.example.environment_service.dto.BatchJobRequest;
import com.example.environment_service.dto.EnvironmentActionRequest;
import com.example.environment_service.dto.EnvironmentRequest;
import com.example.environment_service.dto.ExpirySweepTrigger;
import com.example.environment_service.kafka.KafkaTopics;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;

import java.util.HashMap;
import java.util.Map;

@Configuration
@EnableKafka
public class KafkaConsumerConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, EnvironmentRequest> provisionKafkaListenerContainerFactory() {
        return listenerFactory(EnvironmentRequest.class);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, EnvironmentActionRequest> actionKafkaListenerContainerFactory() {
        return listenerFactory(EnvironmentActionRequest.class);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, BatchJobRequest> batchKafkaListenerContainerFactory() {
        return listenerFactory(BatchJobRequest.class);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, ExpirySweepTrigger> sweepKafkaListenerContainerFactory() {
        return listenerFactory(ExpirySweepTrigger.class);
    }

    <T> ConsumerFactory<String, T> consumerFactory(Class<T> payloadType) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, KafkaTopics.GROUP_ID);

        // bad payloads are logged by the container instead of blocking the partition
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ErrorHandlingDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ErrorHandlingDeserializer.class);
        props.put(ErrorHandlingDeserializer.KEY_DESERIALIZER_CLASS, StringDeserializer.class);
        props.put(ErrorHandlingDeserializer.VALUE_DESERIALIZER_CLASS, JsonDeserializer.class);

        props.put(JsonDeserializer.TRUSTED_PACKAGES, "*");
        props.put(JsonDeserializer.VALUE_DEFAULT_TYPE, payloadType.getName());
        props.put(JsonDeserializer.USE_TYPE_INFO_HEADERS, false);

        return new DefaultKafkaConsumerFactory<>(props);
    }

    private <T> ConcurrentKafkaListenerContainerFactory<String, T> listenerFactory(Class<T> payloadType) {
        ConcurrentKafkaListenerContainerFactory<String, T> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory(payloadType));
        return factory;
    }
}
