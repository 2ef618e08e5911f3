/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api;

import com.glossa.soundchange.api.model.LanguageDefinition;
import com.glossa.soundchange.runtime.model.LanguageModel;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for compiling language definitions into a validated language model.
 */
public interface ILanguageCompiler {

    /**
     * Compiles a language from a JSON file.
     *
     * @param definitionPath path to JSON language definition
     * @return compiled language model
     * @throws IOException if the file cannot be read or parsed
     */
    LanguageModel compile(Path definitionPath) throws IOException;

    /**
     * Compiles an already parsed definition.
     */
    LanguageModel compile(LanguageDefinition definition);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }
}
