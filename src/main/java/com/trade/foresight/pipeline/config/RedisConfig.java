package com.trade.foresight.pipeline.config;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.core.FastStateStore;
import com.trade.foresight.pipeline.core.RedisFastStateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Control plane in Redis; host/port picked from spring.data.redis.*.
 */
@Configuration
@ConditionalOnProperty(name = "foresight.state.backend", havingValue = "redis")
public class RedisConfig {

    @Bean
    public FastStateStore fastStateStore(StringRedisTemplate template, ForesightProperties props) {
        return new RedisFastStateStore(template, props.getState().getKeyPrefix());
    }
}
