package com.arunika.websocket.handler;

import com.arunika.websocket.config.VoiceProperties;
import com.arunika.websocket.domain.ControlMessage;
import com.arunika.websocket.domain.ControlMessage.MessageType;
import com.arunika.websocket.exception.ProtocolException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses and validates device control messages, and encodes server messages.
 */
@Component
public class ControlMessageCodec {

    private static final Pattern LANGUAGE_TAG = Pattern.compile("^[a-z]{2,3}(-[A-Z]{2})?$");

    private final ObjectMapper objectMapper;
    private final int minSampleRate;
    private final int maxSampleRate;
    private final Set<String> supportedEncodings;

    public ControlMessageCodec(ObjectMapper objectMapper, VoiceProperties properties) {
        this.objectMapper = objectMapper;
        this.minSampleRate = properties.getAudio().getMinSampleRate();
        this.maxSampleRate = properties.getAudio().getMaxSampleRate();
        this.supportedEncodings = properties.getAudio().getSupportedEncodings().stream()
                .map(e -> e.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @throws ProtocolException if the payload is not a valid device message
     */
    public ControlMessage parse(String payload) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("malformed control message", e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("control message must be a JSON object");
        }

        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new ProtocolException("control message has no type");
        }
        MessageType type = MessageType.fromWire(typeNode.asText())
                .orElseThrow(() -> new ProtocolException("unsupported message type: " + typeNode.asText()));
        if (!type.isDeviceOriginated()) {
            throw new ProtocolException("message type not accepted from devices: " + type.wireName());
        }

        // Firmware clocks vary; only numeric timestamps are kept
        ObjectNode object = (ObjectNode) node;
        JsonNode timestamp = object.get("timestamp");
        if (timestamp != null && !timestamp.isIntegralNumber()) {
            object.remove("timestamp");
        }

        ControlMessage message;
        try {
            message = objectMapper.treeToValue(object, ControlMessage.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("invalid field in " + type.wireName() + " message", e);
        }

        if (type == MessageType.LISTENING_START) {
            validateAudioParameters(message);
        }
        return message;
    }

    private void validateAudioParameters(ControlMessage message) {
        Integer sampleRate = message.getSampleRate();
        if (sampleRate != null && (sampleRate < minSampleRate || sampleRate > maxSampleRate)) {
            throw new ProtocolException("sample_rate must be between " + minSampleRate + " and " + maxSampleRate);
        }

        String encoding = message.getEncoding();
        if (encoding != null) {
            String normalized = encoding.toUpperCase(Locale.ROOT);
            if (!supportedEncodings.contains(normalized)) {
                throw new ProtocolException("unsupported encoding: " + encoding);
            }
            message.setEncoding(normalized);
        }

        String language = message.getLanguage();
        if (language != null && !LANGUAGE_TAG.matcher(language).matches()) {
            throw new ProtocolException("invalid language: " + language);
        }
    }

    public String encode(ControlMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode " + message.getType(), e);
        }
    }
}
