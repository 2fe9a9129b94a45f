package com.arunika.websocket.domain;

/**
 * Error codes carried by {@code error} control messages.
 */
public enum ErrorCode {

    /** Malformed or unsupported control message. Connection stays open. */
    VALIDATION_ERROR,

    /** Operation not valid for the connection's current state. No mutation. */
    STATE_ERROR,

    /** A provider capability call failed. */
    STREAM_ERROR,

    /** The pipeline deadline elapsed. */
    TIMEOUT_ERROR,

    /** Session store failure. */
    RESOURCE_ERROR,

    /** The utterance was rejected by content moderation. */
    CONTENT_REJECTED
}
