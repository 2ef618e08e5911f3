/*
 * Copyright (c) 2025 Glossa Sound Change Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.glossa.soundchange.api.exceptions;

/**
 * Thrown when a sound change rule is structurally invalid, e.g. source and
 * target differ in length or the environment does not hold exactly one focus.
 */
public class MalformedRuleException extends CompilationException {

    public MalformedRuleException(String message) {
        super(message);
    }

    public MalformedRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
