package com.travelease.formapi.domain.model;

/**
 * Raw inbound body as received from the transport, before any decoding.
 *
 * @param body          body bytes, may be {@code null} when the request carried none
 * @param base64Encoded whether the transport delivered the body base64-encoded
 */
public record RequestEnvelope(byte[] body, boolean base64Encoded) {

    public static RequestEnvelope plain(byte[] body) {
        return new RequestEnvelope(body, false);
    }

    public static RequestEnvelope base64(byte[] body) {
        return new RequestEnvelope(body, true);
    }
}
