/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server.http;

import ai.evacortex.pltx.core.streaming.StreamChannel;
import ai.evacortex.pltx.core.streaming.StreamMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.StatusCode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link StreamChannel} over a Jetty WebSocket session. Messages are JSON text
 * frames sent with the blocking remote, so a slow client slows its worker down.
 */
final class WsStreamChannel implements StreamChannel {

    /** Close reasons are limited to 123 bytes by the WebSocket protocol. */
    private static final int MAX_REASON_BYTES = 123;

    private final Session session;
    private final ObjectMapper mapper;

    WsStreamChannel(Session session, ObjectMapper mapper) {
        this.session = session;
        this.mapper = mapper;
    }

    @Override
    public void send(StreamMessage message) throws IOException {
        session.getRemote().sendString(mapper.writeValueAsString(message));
    }

    @Override
    public void complete() {
        session.close(StatusCode.NORMAL, "end of stream");
    }

    @Override
    public void fail(String reason) {
        session.close(StatusCode.SERVER_ERROR, truncate(reason == null ? "stream failed" : reason));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    static String truncate(String reason) {
        byte[] bytes = reason.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= MAX_REASON_BYTES) return reason;
        int end = reason.length();
        while (reason.substring(0, end).getBytes(StandardCharsets.UTF_8).length > MAX_REASON_BYTES - 3) {
            end--;
        }
        return reason.substring(0, end) + "...";
    }
}
