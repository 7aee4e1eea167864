package dev.chatstore.storage.web;

/**
 * Raised by controllers when a lookup came back empty; rendered as 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
