package com.arunika.websocket.handler;

import com.arunika.websocket.capability.ConversationModel;
import com.arunika.websocket.capability.SessionStore;
import com.arunika.websocket.capability.SpeechRecognizer;
import com.arunika.websocket.config.VoiceProperties;
import com.arunika.websocket.service.ConversationPipelineService;
import com.arunika.websocket.service.MetricsService;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Collaborators shared by every {@link DeviceConnection}.
 */
@Value
@Builder
public class ConnectionServices {
    SessionStore sessionStore;
    SpeechRecognizer speechRecognizer;
    ConversationModel conversationModel;
    ConversationPipelineService pipeline;
    ControlMessageCodec codec;
    MetricsService metrics;
    ExecutorService writerExecutor;
    ExecutorService pipelineExecutor;
    VoiceProperties properties;
    Clock clock;
}
