package com.example.nodelearn.error;

public class SuggestionProviderException extends NodeLearnException {

    public SuggestionProviderException(String message) {
        super(ErrorKind.TRANSIENT, message);
    }

    public SuggestionProviderException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, message, cause);
    }
}
