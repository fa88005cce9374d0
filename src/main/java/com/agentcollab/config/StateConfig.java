package com.agentcollab.config;

import com.agentcollab.core.state.FileStateStore;
import com.agentcollab.core.state.StateStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class StateConfig {

    @Bean
    public StateStore stateStore(CollabProperties properties) {
        return new FileStateStore(Path.of(properties.getTaskDir()));
    }

    /**
     * In-memory registry for CLI runs; replaced when an exporter registry is on the classpath.
     */
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
