/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.exceptions;

/**
 * Root of every construction-time failure: inventory registration, rule
 * definition and language loading.
 *
 * This is a RuntimeException so that builders and fluent registration calls
 * stay free of checked exception handling. Applying rules to a word never
 * throws it.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }

    public CompilationException(Throwable cause) {
        super(cause);
    }
}
