/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage.io.format;

/**
 * One row of the index table: where a chunk of a signal starts and the time span it covers.
 */
public record IndexEntry(int signalId, long chunkOffset, double minTimestamp, double maxTimestamp) {

    public static final int SIZE = 4 + 8 + 8 + 8;
}
