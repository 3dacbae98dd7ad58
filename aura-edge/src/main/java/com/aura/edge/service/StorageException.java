package com.aura.edge.service;

/**
 * The local store could not complete a read or write. Commands that need durability
 * must not be acknowledged when this is thrown.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
