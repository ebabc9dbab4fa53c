package com.project.image.enhancement.exceptions;

public class StoredFileNotFoundException extends StorageException {
    public StoredFileNotFoundException(String message) { super(message); }
}
