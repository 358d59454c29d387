package com.example.nodelearn.error;

public class TreeAlreadyInitializedException extends NodeLearnException {

    public TreeAlreadyInitializedException(String message) {
        super(ErrorKind.STRUCTURAL, message);
    }
}
