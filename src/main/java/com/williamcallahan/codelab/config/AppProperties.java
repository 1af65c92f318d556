package com.williamcallahan.codelab.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private CodelabParsingConfig parser = new CodelabParsingConfig();

    public CodelabParsingConfig getParser() {
        return parser;
    }

    public void setParser(CodelabParsingConfig parser) {
        this.parser = parser;
    }

    /**
     * Fails startup on invalid parsing settings.
     */
    @PostConstruct
    public void validateConfiguration() {
        parser.validateConfiguration();
    }
}
