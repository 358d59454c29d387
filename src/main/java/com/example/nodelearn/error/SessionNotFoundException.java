package com.example.nodelearn.error;

public class SessionNotFoundException extends NodeLearnException {

    public SessionNotFoundException(String message) {
        super(ErrorKind.STRUCTURAL, message);
    }
}
