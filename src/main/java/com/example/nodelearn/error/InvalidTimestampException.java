package com.example.nodelearn.error;

public class InvalidTimestampException extends NodeLearnException {

    public InvalidTimestampException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
