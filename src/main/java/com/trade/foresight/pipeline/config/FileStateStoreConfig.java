package com.trade.foresight.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.foresight.pipeline.common.constants.ForesightProperties;
import com.trade.foresight.pipeline.core.FastStateStore;
import com.trade.foresight.pipeline.core.FileFastStateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

@Configuration
@ConditionalOnProperty(name = "foresight.state.backend", havingValue = "file", matchIfMissing = true)
public class FileStateStoreConfig {

    @Bean
    public FastStateStore fastStateStore(ForesightProperties props, ObjectMapper mapper) {
        return new FileFastStateStore(Paths.get(props.getPaths().getStateDir()), props.getState().getKeyPrefix(), mapper);
    }
}
