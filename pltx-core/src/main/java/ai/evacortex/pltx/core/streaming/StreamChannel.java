/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.streaming;

import java.io.IOException;

/**
 * Outbound side of one stream, implemented by the transport.
 *
 * <p>
 * {@link #send(StreamMessage)} may block until the transport accepts the message;
 * that blocking is the only backpressure a session sees.
 * </p>
 */
public interface StreamChannel {

    /** @throws IOException if the peer is gone or the transport failed */
    void send(StreamMessage message) throws IOException;

    /** Closes the channel normally after the end message. */
    void complete();

    /** Closes the channel with an error; no end message is sent before it. */
    void fail(String reason);

    boolean isOpen();
}
