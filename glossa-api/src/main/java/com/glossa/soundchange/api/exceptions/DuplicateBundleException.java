/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.exceptions;

/**
 * Thrown when a registration would bind one feature bundle to two symbols,
 * or one symbol to two bundles.
 */
public class DuplicateBundleException extends CompilationException {

    public DuplicateBundleException(String message) {
        super(message);
    }
}
