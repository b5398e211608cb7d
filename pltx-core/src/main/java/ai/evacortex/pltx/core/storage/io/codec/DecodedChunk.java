/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage.io.codec;

/**
 * Samples of one chunk as parallel arrays. Instances are shared read-only between
 * cursors through the chunk cache and must never be mutated.
 */
public final class DecodedChunk {

    private final double[] timestamps;
    private final double[] values;

    DecodedChunk(double[] timestamps, double[] values) {
        this.timestamps = timestamps;
        this.values = values;
    }

    public int size()                 { return timestamps.length; }
    public double timestamp(int i)    { return timestamps[i]; }
    public double value(int i)        { return values[i]; }

    /** Approximate heap footprint, used as the cache weight. */
    public int weightInBytes() {
        return 32 + timestamps.length * 16;
    }
}
