package com.rtbhouse.kafka.dispatch.impl.errors;

import com.rtbhouse.kafka.dispatch.api.DispatchException;

public class PoolFaultException extends DispatchException {

    private static final long serialVersionUID = 1L;

    public PoolFaultException(String message, Throwable cause) {
        super(message, cause);
    }

    public PoolFaultException(String message) {
        super(message);
    }

    public PoolFaultException(Throwable cause) {
        super(cause);
    }

}
