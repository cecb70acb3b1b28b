package com.dpp.audit.exception;

/**
 * An event field cannot be canonicalized for hashing. This is a programming
 * error in the caller, never coerced into something hashable.
 */
public class MalformedEventFieldException extends IllegalArgumentException {

    public MalformedEventFieldException(String message) {
        super(message);
    }
}
