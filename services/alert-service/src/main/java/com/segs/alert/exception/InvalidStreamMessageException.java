package com.segs.alert.exception;

/**
 * An inbound stream record cannot be parsed or lacks required fields.
 * Such records are dead-lettered without retry.
 */
public class InvalidStreamMessageException extends AlertServiceException {

    public InvalidStreamMessageException(String message) {
        super("INVALID_MESSAGE", message);
    }

    public InvalidStreamMessageException(String message, Throwable cause) {
        super("INVALID_MESSAGE", message, cause);
    }
}
