package com.dpp.audit.exception;

public class LeafIndexOutOfRangeException extends IndexOutOfBoundsException {

    public LeafIndexOutOfRangeException(int index, int leafCount) {
        super("Index " + index + " out of range for " + leafCount + " leaves");
    }
}
