package com.trade.foresight.pipeline.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trade.foresight.pipeline.common.Sleeper;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class CustomConfig {

    @Bean
    public RestTemplate inferenceRestTemplate(RestTemplateBuilder builder, ForesightProperties props) {
        return builder
                .setConnectTimeout(props.getInference().getConnectTimeout())
                .setReadTimeout(props.getInference().getReadTimeout())
                .build();
    }

    @Bean
    public RestTemplate marketRestTemplate(RestTemplateBuilder builder, ForesightProperties props) {
        return builder
                .setConnectTimeout(props.getMarket().getConnectTimeout())
                .setReadTimeout(props.getMarket().getReadTimeout())
                .build();
    }

    @Bean
    @Primary
    public ObjectMapper mapper() {
        return pipelineMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    /**
     * Mapper shared by the control plane, the bus and the version registry.
     * Also used directly by tests so wire formats stay identical.
     */
    public static ObjectMapper pipelineMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_ARRAY_AS_NULL_OBJECT, true);
        return mapper;
    }
}
