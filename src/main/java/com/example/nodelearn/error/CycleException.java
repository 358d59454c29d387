package com.example.nodelearn.error;

public class CycleException extends NodeLearnException {

    public CycleException(String message) {
        super(ErrorKind.STRUCTURAL, message);
    }
}
