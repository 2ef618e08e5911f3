/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.exceptions;

/**
 * Thrown when a feature bundle does not take exactly one feature from each
 * category required by its sound class, or names a feature outside the taxonomy.
 */
public class InvalidFeatureMatrixException extends CompilationException {

    public InvalidFeatureMatrixException(String message) {
        super(message);
    }
}
