/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.streaming;

import ai.evacortex.pltx.core.Sample;
import ai.evacortex.pltx.core.exceptions.ChunkDecodeException;
import ai.evacortex.pltx.core.exceptions.ChunkReadException;
import ai.evacortex.pltx.core.storage.SignalCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Drains one {@link SignalCursor} into one {@link StreamChannel}.
 *
 * <p>
 * Every sample becomes one data message. When the cursor ends, exactly one end
 * message follows, carrying the last sample's timestamp and value (zero when the
 * signal had none), and the channel is completed without waiting for the peer. A
 * cursor failure closes the channel through {@link StreamChannel#fail(String)} and
 * never produces an end message. Any other unexpected exception, from the cursor or
 * the channel, also fails the channel (with {@value #INTERNAL_ERROR}) rather than
 * leaving the peer waiting.
 * </p>
 *
 * <p>
 * {@link #run()} is called once, on a worker thread. {@link #cancel()} may be called
 * from any thread; the session notices it before the next message. The cursor is
 * closed when {@code run()} returns, whatever the outcome.
 * </p>
 */
public final class StreamingSession {

    private static final Logger log = LoggerFactory.getLogger(StreamingSession.class);

    static final String INTERNAL_ERROR = "internal error";

    private final String signal;
    private final SignalCursor cursor;
    private final StreamChannel channel;
    private volatile boolean cancelled;

    public StreamingSession(String signal, SignalCursor cursor, StreamChannel channel) {
        this.signal = signal;
        this.cursor = cursor;
        this.channel = channel;
    }

    public StreamOutcome run() {
        try {
            double lastTimestamp = 0.0;
            double lastValue = 0.0;
            while (true) {
                if (cancelled || !channel.isOpen()) return cancelledAt();

                Optional<Sample> next;
                try {
                    next = cursor.next();
                } catch (ChunkDecodeException | ChunkReadException e) {
                    log.warn("Stream of '{}' failed after {} samples: {}", signal, cursor.seq(), e.getMessage());
                    channel.fail(e.getMessage());
                    return StreamOutcome.FAILED;
                }

                if (next.isEmpty()) {
                    if (!send(StreamMessage.end(cursor.seq(), lastTimestamp, lastValue))) return cancelledAt();
                    channel.complete();
                    log.debug("Stream of '{}' completed with {} samples", signal, cursor.seq());
                    return StreamOutcome.COMPLETED;
                }

                Sample sample = next.get();
                lastTimestamp = sample.timestamp();
                lastValue = sample.value();
                if (!send(StreamMessage.data(sample, cursor.seq() - 1))) return cancelledAt();
            }
        } catch (RuntimeException e) {
            log.error("Stream of '{}' crashed after {} samples", signal, cursor.seq(), e);
            try {
                channel.fail(INTERNAL_ERROR);
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
                log.warn("Could not close the channel of '{}': {}", signal, closeFailure.toString());
            }
            return StreamOutcome.FAILED;
        } finally {
            cursor.close();
        }
    }

    /** Asks a running session to stop before its next message. */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String signal() {
        return signal;
    }

    private boolean send(StreamMessage message) {
        try {
            channel.send(message);
            return true;
        } catch (IOException e) {
            log.debug("Peer of '{}' stream went away at seq {}: {}", signal, message.seq(), e.getMessage());
            return false;
        }
    }

    private StreamOutcome cancelledAt() {
        log.debug("Stream of '{}' cancelled after {} samples", signal, cursor.seq());
        return StreamOutcome.CANCELLED;
    }
}
