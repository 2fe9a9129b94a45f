package com.arunika.websocket.controller;

import com.arunika.websocket.model.SagaStatusResponse;
import com.arunika.websocket.saga.SagaManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sagas")
@RequiredArgsConstructor
public class SagaController {

    private final SagaManager sagaManager;

    @GetMapping("/{sagaId}")
    public ResponseEntity<SagaStatusResponse> getSaga(@PathVariable String sagaId) {
        return sagaManager.get(sagaId)
                .map(SagaStatusResponse::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
