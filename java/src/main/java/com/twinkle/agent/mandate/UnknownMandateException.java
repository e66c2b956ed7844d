package com.twinkle.agent.mandate;

import com.twinkle.agent.TwinkleException;

public class UnknownMandateException extends TwinkleException {
    public UnknownMandateException(MandateType expected, String id) {
        super("No " + expected.wireName() + " mandate with id " + id);
    }
}
