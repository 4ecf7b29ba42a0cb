package com.nevis.places.config;

import com.nevis.places.gazetteer.Gazetteer;
import com.nevis.places.gazetteer.GazetteerLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GazetteerConfig {

    /**
     * Loaded once during context refresh. A {@link com.nevis.places.exception.GazetteerLoadException}
     * here stops the application from starting.
     */
    @Bean
    public Gazetteer gazetteer(GazetteerLoader loader, GazetteerProperties properties) {
        return loader.load(properties.source());
    }
}
