package com.example.nodelearn.error;

public class InvalidTopicException extends NodeLearnException {

    public InvalidTopicException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
