package com.evidencetrust.enhancement;

public class EnhancementException extends RuntimeException {
    public EnhancementException(String message) {
        super(message);
    }

    public EnhancementException(String message, Throwable cause) {
        super(message, cause);
    }
}
