package com.chemfetch.sds.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonScraperConfig {

    /**
     * A dedicated {@link ObjectMapper} for search API payloads, remote
     * capability responses and the {@code raw_json} provenance blobs.
     * <p>
     * • Qualified as <b>scraperObjectMapper</b>; being the only mapper in the
     * context it also serialises the MVC responses.<br>
     * • Dates are written as ISO strings ({@code 2024-03-01}), unknown
     * properties of third-party payloads are ignored.
     *
     * @return ObjectMapper for scraping and extraction payloads
     */
    @Bean
    @Qualifier("scraperObjectMapper")
    public ObjectMapper scraperObjectMapper() {

        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

}
