package com.p14n.pollevent.group;

public class InvalidPollRateException extends RuntimeException {

    public InvalidPollRateException(double rate) {
        super("Poll rate must be a positive finite number of seconds: " + rate);
    }
}
