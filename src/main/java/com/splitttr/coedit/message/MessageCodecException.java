package com.splitttr.coedit.message;

public class MessageCodecException extends RuntimeException {

    public MessageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
