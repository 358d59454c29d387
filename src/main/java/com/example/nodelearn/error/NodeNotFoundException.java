package com.example.nodelearn.error;

public class NodeNotFoundException extends NodeLearnException {

    public NodeNotFoundException(String message) {
        super(ErrorKind.STRUCTURAL, message);
    }
}
