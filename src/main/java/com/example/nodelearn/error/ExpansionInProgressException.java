package com.example.nodelearn.error;

public class ExpansionInProgressException extends NodeLearnException {

    public ExpansionInProgressException(String message) {
        super(ErrorKind.CONCURRENCY, message);
    }
}
