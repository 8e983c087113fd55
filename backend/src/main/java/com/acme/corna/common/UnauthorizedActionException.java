package com.acme.corna.common;

/**
 * The caller is known but lacks the permission the action needs on a corna.
 */
public class UnauthorizedActionException extends RuntimeException {
    public UnauthorizedActionException(String message) {
        super(message);
    }
}
