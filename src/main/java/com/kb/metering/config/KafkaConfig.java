package com.kb.metering.config;

import com.kb.metering.model.event.SessionEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.reactive.ReactiveKafkaProducerTemplate;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.sender.SenderOptions;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka 설정 클래스
 * 세션 라이프사이클 이벤트용 Reactive Producer/Consumer 설정
 */
@Configuration
@Slf4j
public class KafkaConfig {
    
    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;
    
    @Value("${server.instance.id}")
    private String serverInstanceId;

    @Value("${metering.kafka.topics.session-events}")
    private String sessionEventsTopic;
    
    /**
     * Reactive Kafka Producer 설정
     */
    @Bean
    public SenderOptions<String, SessionEvent> sessionEventSenderOptions() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        
        // 과금 이벤트는 유실되면 안 되므로 전체 복제 확인
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);
        
        props.put(ProducerConfig.CLIENT_ID_CONFIG, "metering-producer-" + serverInstanceId);
        
        return SenderOptions.create(props);
    }

    @Bean
    public ReactiveKafkaProducerTemplate<String, SessionEvent> sessionEventProducerTemplate(
            SenderOptions<String, SessionEvent> sessionEventSenderOptions) {
        return new ReactiveKafkaProducerTemplate<>(sessionEventSenderOptions);
    }
    
    /**
     * Reactive Kafka Consumer 설정
     * 인스턴스마다 별도 그룹으로 구독하여 모든 인스턴스가 이벤트를 수신
     */
    @Bean
    public ReceiverOptions<String, SessionEvent> sessionEventReceiverOptions() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "metering-" + serverInstanceId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, JsonDeserializer.class);
        
        props.put(JsonDeserializer.TRUSTED_PACKAGES, "com.kb.metering.model.event");
        props.put(JsonDeserializer.USE_TYPE_INFO_HEADERS, false);
        props.put(JsonDeserializer.VALUE_DEFAULT_TYPE, SessionEvent.class.getName());
        
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, true);
        props.put(ConsumerConfig.AUTO_COMMIT_INTERVAL_MS_CONFIG, 1000);
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 500);
        
        props.put(ConsumerConfig.CLIENT_ID_CONFIG, "metering-consumer-" + serverInstanceId);
        
        log.info("세션 이벤트 Consumer 설정: topic={}, group=metering-{}", sessionEventsTopic, serverInstanceId);
        
        return ReceiverOptions.<String, SessionEvent>create(props)
                .subscription(Collections.singleton(sessionEventsTopic));
    }
}
