/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.streaming;

public enum StreamOutcome {
    /** Every sample and the end message were sent. */
    COMPLETED,
    /** The cursor failed; the channel was closed with an error. */
    FAILED,
    /** The peer went away or the session was cancelled. */
    CANCELLED
}
