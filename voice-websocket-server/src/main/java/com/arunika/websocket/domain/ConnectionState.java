package com.arunika.websocket.domain;

/**
 * Lifecycle of a device connection.
 *
 * <pre>
 * IDLE -> LISTENING -> PROCESSING -> SPEAKING -> IDLE
 *                      PROCESSING -> IDLE (pipeline failure, empty transcript)
 * any  -> CLOSED (disconnect)
 * </pre>
 */
public enum ConnectionState {
    IDLE,
    LISTENING,
    PROCESSING,
    SPEAKING,
    CLOSED
}
