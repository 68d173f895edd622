package com.opentrips.common.exception;

/**
 * Request was well formed but collides with the current state of a resource.
 * Mapped to HTTP 409; subclasses carry their own error code.
 */
public abstract class ConflictException extends BusinessException {

    protected ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }

    protected ConflictException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
