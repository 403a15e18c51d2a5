package com.example.carerota.exception;

/**
 * A referenced record (home, shift, template, staff member) does not exist.
 * Surfaced as 404 so callers can run their default-creation flows.
 */
public class ResourceNotFoundException extends BusinessException {

    public ResourceNotFoundException(String resource, Object id) {
        super("NOT_FOUND", resource + " not found: " + id, resource, id);
    }
}
