package com.arunika.websocket.capability;

import com.arunika.websocket.domain.ModerationResult;

public interface ContentModerator {

    ModerationResult review(String text);
}
