package com.spreadsheet.formula.config;

import com.spreadsheet.formula.functions.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the shared, stateless parts of the engine.
 */
@Configuration
@EnableConfigurationProperties(SheetProperties.class)
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    /**
     * Clock for NOW, TODAY, DATE and DATEDIF. Blank {@code formula.time-zone} means the system zone.
     */
    @Bean
    public Clock formulaClock(@Value("${formula.time-zone:}") String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        log.info("Formula date functions use time zone {}", timeZone);
        return Clock.system(ZoneId.of(timeZone.trim()));
    }

    @Bean
    public FunctionRegistry functionRegistry(Clock formulaClock) {
        return new FunctionRegistry(formulaClock);
    }
}
