package com.example.nodelearn.error;

public class StoreUnavailableException extends NodeLearnException {

    public StoreUnavailableException(String message) {
        super(ErrorKind.TRANSIENT, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, message, cause);
    }
}
