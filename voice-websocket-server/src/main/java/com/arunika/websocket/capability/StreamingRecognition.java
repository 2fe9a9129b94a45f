package com.arunika.websocket.capability;

/**
 * An open recognition stream. {@link #stream(byte[])} is only ever called by
 * the connection's read unit; {@link #cancel()} may come from any thread.
 */
public interface StreamingRecognition {

    /**
     * Forwards one audio frame, in arrival order.
     */
    void stream(byte[] audio);

    /**
     * Closes the stream and returns the final transcript. A second call fails
     * with a {@link com.arunika.websocket.exception.StreamException}.
     */
    String end();

    /**
     * Abandons the stream. Safe to call more than once.
     */
    void cancel();
}
