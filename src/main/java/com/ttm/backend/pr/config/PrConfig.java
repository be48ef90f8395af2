package com.ttm.backend.pr.config;

import com.ttm.backend.pr.service.PrLineParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(PrProperties.class)
public class PrConfig {

    @Bean
    public PrLineParser prLineParser(PrProperties props) {
        var settings = props.toSettings();
        log.info("pr_parser mode={} threshold={} nearMissFloor={} formula={}",
                settings.mode(), settings.fuzzyThreshold(), settings.nearMissFloor(), settings.formula());
        return new PrLineParser(settings);
    }
}
