package com.example.nodelearn.error;

public class DocumentParseException extends NodeLearnException {

    public DocumentParseException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
