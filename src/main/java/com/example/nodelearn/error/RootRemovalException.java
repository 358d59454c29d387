package com.example.nodelearn.error;

public class RootRemovalException extends NodeLearnException {

    public RootRemovalException(String message) {
        super(ErrorKind.STRUCTURAL, message);
    }
}
