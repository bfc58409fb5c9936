package com.travelease.formapi.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.travelease.formapi.domain.exception.MalformedRequestException;
import com.travelease.formapi.domain.model.RequestEnvelope;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Turns the raw request envelope into the JSON object it carries.
 */
@Service
public class RequestDecoder {

    private final ObjectMapper objectMapper;

    public RequestDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> decode(RequestEnvelope envelope) {
        byte[] raw = envelope.body() != null ? envelope.body() : new byte[0];

        if (envelope.base64Encoded()) {
            try {
                raw = Base64.getDecoder().decode(raw);
            } catch (IllegalArgumentException e) {
                throw new MalformedRequestException("Request body is not valid base64.", e);
            }
        }

        String body = toUtf8(raw);
        if (body.isEmpty()) {
            throw new MalformedRequestException("Request body is required.");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedRequestException("Request body must be valid JSON.", e);
        }
        if (node == null || node.isMissingNode()) {
            throw new MalformedRequestException("Request body must be valid JSON.");
        }
        if (!node.isObject()) {
            throw new MalformedRequestException("Request body must be a JSON object.");
        }

        return objectMapper.convertValue(node, new TypeReference<Map<String, Object>>() {
        });
    }

    private String toUtf8(byte[] raw) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MalformedRequestException("Request body is not valid UTF-8.", e);
        }
    }
}
