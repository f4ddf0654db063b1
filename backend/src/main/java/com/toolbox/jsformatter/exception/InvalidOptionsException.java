package com.toolbox.jsformatter.exception;

public class InvalidOptionsException extends Exception {

    public InvalidOptionsException(String message) {
        super(message);
    }

    public InvalidOptionsException(String message, Throwable cause) {
        super(message, cause);
    }
}
