package com.arunika.websocket.saga.conversation;

/**
 * Saga data keys shared by the conversation steps.
 */
public final class ConversationDataKeys {

    public static final String DEVICE_ID = "device_id";
    public static final String SESSION_ID = "session_id";
    public static final String AUDIO = "audio";
    public static final String AUDIO_CONFIG = "audio_config";
    public static final String TRANSCRIPT = "transcript";
    public static final String CONTENT_SAFE = "content_safe";
    public static final String CONVERSATION = "conversation";
    public static final String REPLY = "reply";
    public static final String VOICE = "voice";
    public static final String RESPONSE_AUDIO = "response_audio";

    private ConversationDataKeys() {
    }
}
