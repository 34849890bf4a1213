package com.trade.foresight.pipeline.bus;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.trade.foresight.pipeline.model.ControlEntity;
import com.trade.foresight.pipeline.model.PriceCandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaCandleStreamFactory implements CandleStreamFactory {

    private static final TypeReference<List<PriceCandle>> BATCH = new TypeReference<List<PriceCandle>>() {
    };

    private final ObjectMapper mapper;

    @Override
    public CandleStream open(ControlEntity entity) {
        String group = CandleTopics.consumerGroup(entity);
        String topic = CandleTopics.topic(entity.getSymbol());
        Properties p = KafkaPropertiesHelper.loadConsumerProps(group);
        KafkaConsumer<String, String> consumer = new KafkaConsumer<>(p);
        consumer.subscribe(Collections.singletonList(topic));
        log.info("Subscribed to {} as group {} (bootstrap.servers={})", topic, group, p.getProperty("bootstrap.servers"));
        return new KafkaCandleStream(consumer, entity.getSymbol(), mapper);
    }

    /**
     * Decodes each record value as a JSON array of candles; undecodable
     * records are logged and skipped.
     */
    public static final class KafkaCandleStream implements CandleStream {

        private final Consumer<String, String> consumer;
        private final String symbol;
        private final ObjectReader reader;

        public KafkaCandleStream(Consumer<String, String> consumer, String symbol, ObjectMapper mapper) {
            this.consumer = consumer;
            this.symbol = symbol;
            // a lone candle object is read as a batch of one
            this.reader = mapper.readerFor(BATCH).with(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);
        }

        @Override
        public List<List<PriceCandle>> poll(Duration timeout) {
            List<List<PriceCandle>> out = new ArrayList<>();
            for (ConsumerRecord<String, String> rec : consumer.poll(timeout)) {
                if (rec.value() == null) continue;
                try {
                    List<PriceCandle> batch = reader.readValue(rec.value());
                    batch.forEach(c -> c.setSymbol(symbol));
                    out.add(batch);
                } catch (IOException e) {
                    log.warn("Skipping undecodable message key={} offset={}: {}", rec.key(), rec.offset(), e.getMessage());
                }
            }
            return out;
        }

        @Override
        public void close() {
            consumer.close(Duration.ofSeconds(5));
        }
    }
}
