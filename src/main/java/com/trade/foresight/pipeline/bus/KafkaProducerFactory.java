package com.trade.foresight.pipeline.bus;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;

import java.util.Properties;

/**
 * One Kafka producer per process, created on first use.
 */
public final class KafkaProducerFactory {

    private static volatile Producer<String, String> INSTANCE;

    public static Producer<String, String> get() {
        if (INSTANCE == null) {
            synchronized (KafkaProducerFactory.class) {
                if (INSTANCE == null) {
                    Properties props = KafkaPropertiesHelper.loadProducerProps();
                    INSTANCE = new KafkaProducer<>(props);
                }
            }
        }
        return INSTANCE;
    }

    public static void close() {
        synchronized (KafkaProducerFactory.class) {
            if (INSTANCE != null) {
                INSTANCE.close();
                INSTANCE = null;
            }
        }
    }

    private KafkaProducerFactory() {
    }
}
