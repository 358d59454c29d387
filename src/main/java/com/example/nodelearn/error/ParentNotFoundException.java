package com.example.nodelearn.error;

public class ParentNotFoundException extends NodeLearnException {

    public ParentNotFoundException(String message) {
        super(ErrorKind.STRUCTURAL, message);
    }
}
