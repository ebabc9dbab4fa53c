package com.project.image.enhancement.exceptions;

/** Failure to persist or read an uploaded or processed file. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
