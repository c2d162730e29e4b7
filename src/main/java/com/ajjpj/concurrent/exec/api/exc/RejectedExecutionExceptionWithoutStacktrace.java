package com.ajjpj.concurrent.exec.api.exc;

import java.util.concurrent.RejectedExecutionException;


/**
 * Thrown when work is submitted to an executor that is shut down.
 */
public class RejectedExecutionExceptionWithoutStacktrace extends RejectedExecutionException {
    public RejectedExecutionExceptionWithoutStacktrace (String msg) {
        super (msg);
    }

    @Override public Throwable fillInStackTrace () {
        return this;
    }
}
