/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.infra.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Settings of the word generator.
 *
 * <p>Sources, later ones winning:
 * <ol>
 * <li>builder defaults</li>
 * <li>{@code glossa.properties} from the classpath, or else from the file system</li>
 * <li>environment variables {@code GLOSSA_SEED}, {@code GLOSSA_SYLLABLES}, {@code GLOSSA_TRACE}</li>
 * </ol>
 *
 * <pre>
 * GeneratorConfig config = GeneratorConfig.builder().seed(42).syllables(3).build();
 * </pre>
 */
public final class GeneratorConfig {

    private static final Logger logger = Logger.getLogger(GeneratorConfig.class.getName());

    private static final String DEFAULT_PROPERTIES = "glossa.properties";

    private static final String ENV_SEED = "GLOSSA_SEED";
    private static final String ENV_SYLLABLES = "GLOSSA_SYLLABLES";
    private static final String ENV_TRACE = "GLOSSA_TRACE";

    private static final String PROP_SEED = "glossa.seed";
    private static final String PROP_SYLLABLES = "glossa.syllables";
    private static final String PROP_TRACE = "glossa.trace";

    /** Seed for word generation; null means a fresh random seed per generator. */
    private final Long seed;
    private final int syllables;
    private final boolean traceDerivations;

    private GeneratorConfig(Builder builder) {
        this.seed = builder.seed;
        this.syllables = builder.syllables;
        this.traceDerivations = builder.traceDerivations;
        validate();
    }

    public static GeneratorConfig defaults() {
        return builder().build();
    }

    public static GeneratorConfig fromEnvironment() {
        Builder builder = builder();
        builder.applyEnvironmentVariables();
        return builder.build();
    }

    public static GeneratorConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    public static GeneratorConfig loadFromProperties(String propertiesPath) {
        logger.info("Loading generator configuration from: " + propertiesPath);

        Properties props = new Properties();

        // Try classpath first
        try (InputStream is = GeneratorConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (InputStream is = new FileInputStream(propertiesPath)) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        Builder builder = builderFromProperties(props);
        builder.applyEnvironmentVariables();
        return builder.build();
    }

    static Builder builderFromProperties(Properties props) {
        Builder builder = builder();

        String seed = props.getProperty(PROP_SEED);
        if (seed != null && !seed.isBlank()) {
            builder.seed = parseLong(PROP_SEED, seed).orElse(builder.seed);
        }
        String syllables = props.getProperty(PROP_SYLLABLES);
        if (syllables != null) {
            builder.syllables = parseInt(PROP_SYLLABLES, syllables).orElse(builder.syllables);
        }
        String trace = props.getProperty(PROP_TRACE);
        if (trace != null) {
            builder.traceDerivations = Boolean.parseBoolean(trace.trim());
        }
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.seed = this.seed;
        builder.syllables = this.syllables;
        builder.traceDerivations = this.traceDerivations;
        return builder;
    }

    /**
     * A generator seeded from the configuration, or unseeded when no seed is set.
     */
    public Random newRandom() {
        return seed != null ? new Random(seed) : new Random();
    }

    public Optional<Long> getSeed() {
        return Optional.ofNullable(seed);
    }

    public int getSyllables() {
        return syllables;
    }

    public boolean isTraceDerivations() {
        return traceDerivations;
    }

    private void validate() {
        if (syllables < 1) {
            throw new IllegalArgumentException("syllables must be at least 1, got " + syllables);
        }
    }

    @Override
    public String toString() {
        return String.format("GeneratorConfig{seed=%s, syllables=%d, traceDerivations=%s}",
                seed, syllables, traceDerivations);
    }

    private static Optional<Long> parseLong(String key, String value) {
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            logger.warning("Invalid " + key + ": " + value + ", keeping default");
            return Optional.empty();
        }
    }

    private static Optional<Integer> parseInt(String key, String value) {
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            logger.warning("Invalid " + key + ": " + value + ", keeping default");
            return Optional.empty();
        }
    }

    public static final class Builder {

        private Long seed = null;
        private int syllables = 2;
        private boolean traceDerivations = false;

        private Builder() {
        }

        private void applyEnvironmentVariables() {
            getEnv(ENV_SEED).flatMap(val -> parseLong(ENV_SEED, val)).ifPresent(val -> this.seed = val);
            getEnv(ENV_SYLLABLES).flatMap(val -> parseInt(ENV_SYLLABLES, val)).ifPresent(val -> this.syllables = val);
            getEnv(ENV_TRACE).ifPresent(val -> this.traceDerivations = Boolean.parseBoolean(val.trim()));
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder unseeded() {
            this.seed = null;
            return this;
        }

        public Builder syllables(int syllables) {
            this.syllables = syllables;
            return this;
        }

        public Builder traceDerivations(boolean enable) {
            this.traceDerivations = enable;
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(this);
        }

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
        }
    }
}
