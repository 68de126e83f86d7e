package com.intermission.scheduler.config;

import com.intermission.common.model.AdmissionEvent;
import com.intermission.common.model.PlatformNotification;
import com.intermission.common.model.ShowRequest;
import com.intermission.common.model.ZoneChange;
import com.intermission.scheduler.platform.KafkaPlatformAdapter;
import com.intermission.scheduler.platform.NaturalTimer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@EnableKafka
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrap;

    @Value("${intermission.kafka.group-id:scheduler-service-group}")
    private String groupId;

    // ---- Producers ----

    @Bean
    public KafkaTemplate<String, ShowRequest> showRequestKafkaTemplate() {
        return new KafkaTemplate<>(this.<ShowRequest>producerFactory());
    }

    @Bean
    public KafkaTemplate<String, AdmissionEvent> admissionEventKafkaTemplate() {
        return new KafkaTemplate<>(this.<AdmissionEvent>producerFactory());
    }

    private <V> ProducerFactory<String, V> producerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        // do NOT add type headers
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);
        return new DefaultKafkaProducerFactory<>(props);
    }

    // ---- Consumers ----

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, PlatformNotification> platformNotificationListenerFactory() {
        return listenerFactory(consumerFactory(PlatformNotification.class));
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, ZoneChange> zoneChangeListenerFactory() {
        return listenerFactory(consumerFactory(ZoneChange.class));
    }

    private <V> ConsumerFactory<String, V> consumerFactory(Class<V> type) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        // Use ErrorHandlingDeserializer delegating to JsonDeserializer
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ErrorHandlingDeserializer.class);
        props.put(ErrorHandlingDeserializer.VALUE_DESERIALIZER_CLASS, JsonDeserializer.class);
        props.put(JsonDeserializer.TRUSTED_PACKAGES, "com.intermission.common.model");
        props.put(JsonDeserializer.VALUE_DEFAULT_TYPE, type.getName());
        props.put(JsonDeserializer.USE_TYPE_INFO_HEADERS, false);
        return new DefaultKafkaConsumerFactory<>(props);
    }

    private <V> ConcurrentKafkaListenerContainerFactory<String, V> listenerFactory(ConsumerFactory<String, V> consumerFactory) {
        ConcurrentKafkaListenerContainerFactory<String, V> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory);
        // log and skip poison records instead of stopping the consumer
        factory.setCommonErrorHandler(new DefaultErrorHandler());
        return factory;
    }

    // ---- Platform ----

    @Bean
    public NaturalTimer naturalTimer(Clock clock,
                                     @Value("${intermission.platform.natural-interval:60s}") Duration interval) {
        return new NaturalTimer(clock, interval);
    }

    @Bean
    @ConditionalOnProperty(name = "intermission.platform.enabled", havingValue = "true", matchIfMissing = true)
    public KafkaPlatformAdapter kafkaPlatformAdapter(NaturalTimer naturalTimer,
                                                     Clock clock,
                                                     @Value("${intermission.topics.command:intermission.platform.command}") String commandTopic) {
        return new KafkaPlatformAdapter(showRequestKafkaTemplate(), commandTopic, naturalTimer, clock);
    }
}
