package com.trade.foresight.pipeline.config;

import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.core.FastStateStore;
import com.trade.foresight.pipeline.core.InMemoryFastStateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "foresight.state.backend", havingValue = "memory")
public class InMemoryFastStateConfig {

    @Bean
    public FastStateStore fastStateStore(ForesightProperties props) {
        return new InMemoryFastStateStore(props.getState().getKeyPrefix());
    }
}
