package com.vtrader.realtime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * {@link PushConnection} over a Spring MVC {@link ResponseBodyEmitter}. Frames are
 * written verbatim, so the stream carries exactly {@code data: ...} and comment lines.
 */
public class SseEmitterConnection implements PushConnection {

    private static final Logger log = LoggerFactory.getLogger(SseEmitterConnection.class);

    private static final MediaType FRAME_TYPE = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final String id = UUID.randomUUID().toString().substring(0, 8);
    private final ResponseBodyEmitter emitter;

    public SseEmitterConnection(ResponseBodyEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public synchronized void send(String frame) throws IOException {
        emitter.send(frame, FRAME_TYPE);
    }

    @Override
    public void close() {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("Push stream already completed: connectionId={}", id);
        }
    }
}
