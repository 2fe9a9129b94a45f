package com.arunika.websocket.handler;

import com.arunika.websocket.capability.ConversationModel;
import com.arunika.websocket.capability.SessionStore;
import com.arunika.websocket.capability.SpeechRecognizer;
import com.arunika.websocket.config.VoiceProperties;
import com.arunika.websocket.service.ConversationPipelineService;
import com.arunika.websocket.service.MetricsService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

@Component
public class DeviceConnectionFactory {

    private final ConnectionServices services;

    public DeviceConnectionFactory(SessionStore sessionStore,
                                   SpeechRecognizer speechRecognizer,
                                   ConversationModel conversationModel,
                                   ConversationPipelineService pipeline,
                                   ControlMessageCodec codec,
                                   MetricsService metrics,
                                   @Qualifier("connectionWriterExecutor") ExecutorService writerExecutor,
                                   @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor,
                                   VoiceProperties properties,
                                   Clock clock) {
        this.services = ConnectionServices.builder()
                .sessionStore(sessionStore)
                .speechRecognizer(speechRecognizer)
                .conversationModel(conversationModel)
                .pipeline(pipeline)
                .codec(codec)
                .metrics(metrics)
                .writerExecutor(writerExecutor)
                .pipelineExecutor(pipelineExecutor)
                .properties(properties)
                .clock(clock)
                .build();
    }

    public DeviceConnection create(String deviceId, WebSocketSession wsSession) {
        return new DeviceConnection(deviceId, wsSession, services);
    }
}
