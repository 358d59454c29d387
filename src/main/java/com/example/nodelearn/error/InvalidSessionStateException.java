package com.example.nodelearn.error;

public class InvalidSessionStateException extends NodeLearnException {

    public InvalidSessionStateException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
