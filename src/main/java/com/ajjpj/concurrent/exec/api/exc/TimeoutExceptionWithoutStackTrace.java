package com.ajjpj.concurrent.exec.api.exc;

import java.util.concurrent.TimeoutException;


public class TimeoutExceptionWithoutStackTrace extends TimeoutException {
    public TimeoutExceptionWithoutStackTrace (String msg) {
        super (msg);
    }

    @Override public Throwable fillInStackTrace () {
        return this;
    }
}
