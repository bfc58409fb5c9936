package com.travelease.formapi.domain.exception;

import com.travelease.formapi.domain.model.Channel;

/**
 * A dispatch channel failed while the dispatcher runs in fail-fast mode. The message is the
 * collaborator's own error text.
 */
public class ChannelFailureException extends RuntimeException {

    private final Channel channel;

    public ChannelFailureException(Channel channel, Throwable cause) {
        super(describe(cause), cause);
        this.channel = channel;
    }

    public Channel getChannel() {
        return channel;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getName();
    }
}
