package com.dpp.audit.exception;

public class EmptyMerkleInputException extends IllegalArgumentException {

    public EmptyMerkleInputException(String message) {
        super(message);
    }
}
