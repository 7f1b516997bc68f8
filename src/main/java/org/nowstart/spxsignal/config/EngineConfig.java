package org.nowstart.spxsignal.config;

import org.nowstart.spxsignal.data.property.EngineProperties;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    /**
     * Validated once at startup; an invalid engine configuration stops the context from starting.
     */
    @Bean
    public StrategyConfig strategyConfig(EngineProperties engineProperties) {
        return engineProperties.toStrategyConfig();
    }
}
