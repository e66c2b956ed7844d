package com.twinkle.agent;

/** Root of the unchecked exceptions raised by the procurement core. */
public class TwinkleException extends RuntimeException {

    public TwinkleException(String message) {
        super(message);
    }

    public TwinkleException(String message, Throwable cause) {
        super(message, cause);
    }
}
