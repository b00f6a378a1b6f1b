package com.gbu.courseplatform.exception;

/**
 * Authenticated caller with the wrong role or not the owner of the resource.
 */
public class UnauthorizedAccessException extends RuntimeException {

    public UnauthorizedAccessException(String message) {
        super(message);
    }
}
