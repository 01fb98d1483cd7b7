package com.rtbhouse.kafka.dispatch.api;

public class DispatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(Throwable cause) {
        super(cause);
    }

}
