package com.arunika.websocket.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionMetadata implements Serializable {
    private static final long serialVersionUID = 1L;

    private String language;

    @Builder.Default
    private Map<String, Object> preferences = new HashMap<>();
}
