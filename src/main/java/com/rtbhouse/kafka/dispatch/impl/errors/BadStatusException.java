package com.rtbhouse.kafka.dispatch.impl.errors;

import com.rtbhouse.kafka.dispatch.api.DispatchException;

public class BadStatusException extends DispatchException {

    private static final long serialVersionUID = 1L;

    public BadStatusException(String message, Throwable cause) {
        super(message, cause);
    }

    public BadStatusException(String message) {
        super(message);
    }

    public BadStatusException(Throwable cause) {
        super(cause);
    }

}
