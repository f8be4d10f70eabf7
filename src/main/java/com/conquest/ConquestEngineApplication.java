package com.conquest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main entry point for the Conquest rules engine.
 * <p>
 * Starts a non-web application context holding the map catalog and the game factory; a presentation
 * layer embeds the context and drives {@link com.conquest.engine.Game} instances obtained from
 * {@link com.conquest.service.GameService}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ConquestEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConquestEngineApplication.class, args);
    }
}
