package com.splitttr.coedit.store;

public class OperationStoreException extends RuntimeException {

    public OperationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
