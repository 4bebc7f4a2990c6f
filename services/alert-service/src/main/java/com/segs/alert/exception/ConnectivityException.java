package com.segs.alert.exception;

/**
 * A broker, cache or database is unreachable.
 * Results in HTTP 503 Service Unavailable
 */
public class ConnectivityException extends AlertServiceException {

    public ConnectivityException(String dependency, Throwable cause) {
        super("DEPENDENCY_UNAVAILABLE", dependency + " is unavailable", cause);
    }
}
