package com.vidnyan.doclinks.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for doclinks components.
 */
@Configuration
public class DocLinksConfiguration {

    /**
     * ObjectMapper for reading and writing catalog artifacts.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return artifactMapper();
    }

    /**
     * Clock used for artifact timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The mapper configuration shared by the Spring context and by code built outside it.
     */
    public static ObjectMapper artifactMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }
}
