package com.trade.foresight.pipeline.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.common.exception.BusPublishException;
import com.trade.foresight.pipeline.model.PriceCandle;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Publishes candles to the symbol's topic as JSON arrays of at most
 * {@code publish-chunk} records. Each chunk is sent synchronously; the first
 * unacknowledged chunk aborts the call.
 */
@Slf4j
@Service
public class CandlePublisher {

    private final Supplier<Producer<String, String>> producer;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final int chunkSize;
    private final Runnable closer;

    @Autowired
    public CandlePublisher(ObjectMapper mapper, Clock clock, ForesightProperties props) {
        this(KafkaProducerFactory::get, KafkaProducerFactory::close, mapper, clock,
                props.getProducer().getPublishChunk());
    }

    public CandlePublisher(Supplier<Producer<String, String>> producer, ObjectMapper mapper,
                           Clock clock, int chunkSize) {
        this(producer, () -> producer.get().close(), mapper, clock, chunkSize);
    }

    public CandlePublisher(Supplier<Producer<String, String>> producer, Runnable closer, ObjectMapper mapper,
                           Clock clock, int chunkSize) {
        this.producer = producer;
        this.closer = closer;
        this.mapper = mapper;
        this.clock = clock;
        this.chunkSize = chunkSize;
    }

    /** Flushes and closes the producer on context shutdown. */
    @PreDestroy
    public void close() {
        log.info("Closing Kafka producer");
        closer.run();
    }

    /**
     * @return number of chunks published
     */
    public int publish(String symbol, List<PriceCandle> candles) {
        if (candles == null || candles.isEmpty()) return 0;
        final String topic = CandleTopics.topic(symbol);
        int batches = 0;
        for (int i = 0; i < candles.size(); i += chunkSize) {
            List<PriceCandle> chunk = candles.subList(i, Math.min(i + chunkSize, candles.size()));
            String key = CandleTopics.batchKey(symbol, clock.millis(), i);
            String json;
            try {
                json = mapper.writeValueAsString(chunk);
            } catch (JsonProcessingException e) {
                throw new BusPublishException("Cannot encode candle batch " + key, e);
            }
            try {
                RecordMetadata m = producer.get().send(new ProducerRecord<>(topic, key, json)).get();
                log.info("Published batch {} ({} records) to topic {} partition={} offset={}",
                        batches + 1, chunk.size(), topic, m.partition(), m.offset());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new BusPublishException("Interrupted publishing " + key, ie);
            } catch (ExecutionException | RuntimeException e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                log.error("Error publishing batch {} to {}: {}", key, topic, cause.toString());
                throw new BusPublishException("Publish failed for " + key + ": " + cause.getMessage(), cause);
            }
            batches++;
        }
        return batches;
    }
}
