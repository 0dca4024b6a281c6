package com.sldce.backend.exceptions;

public class UpstreamSignalException extends RuntimeException {
    public UpstreamSignalException(String message) {
        super(message);
    }

    public UpstreamSignalException(String message, Throwable cause) {
        super(message, cause);
    }
}
