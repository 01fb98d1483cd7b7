package com.rtbhouse.kafka.dispatch.impl.errors;

import com.rtbhouse.kafka.dispatch.api.DispatchException;

public class FailedCommitException extends DispatchException {

    private static final long serialVersionUID = 1L;

    public FailedCommitException(String message, Throwable cause) {
        super(message, cause);
    }

    public FailedCommitException(String message) {
        super(message);
    }

    public FailedCommitException(Throwable cause) {
        super(cause);
    }

}
