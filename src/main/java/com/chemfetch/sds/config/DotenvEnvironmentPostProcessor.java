package com.chemfetch.sds.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads a `.env` file and adds its entries as a high-priority property source
 * so that `${GOOGLE_CSE_API_KEY}`, `${TESSDATA_PREFIX}` and friends resolve.
 * The directory defaults to the working directory and can be moved with the
 * {@code dotenv.directory} property. Blank entries are skipped so they never
 * mask a value set elsewhere.
 */
public class DotenvEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    public static final String PROPERTY_SOURCE_NAME = "dotenvProperties";

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(final ConfigurableEnvironment env,
                                       final SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .directory(env.getProperty("dotenv.directory", "."))
                .filename(env.getProperty("dotenv.filename", ".env"))
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();

        Map<String, Object> map = new LinkedHashMap<>();
        for (DotenvEntry e : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            if (e.getValue() != null && !e.getValue().isBlank()) {
                map.put(e.getKey(), e.getValue());
            }
        }
        if (map.isEmpty()) {
            return;
        }

        // front of the list: .env wins over application.yml and system properties
        env.getPropertySources()
                .addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, map));
    }
}
