/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage.io.format;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Header written in front of every chunk payload.
 *
 * <pre>
 *   [MAGIC "CHNK" (4)] [SIGNAL_ID u32] [SAMPLE_COUNT u32] [RAW_LENGTH u32]
 *   [STORED_LENGTH u32] [MIN_TS f64] [MAX_TS f64]
 * </pre>
 *
 * {@code RAW_LENGTH} is the payload size after decompression and always equals
 * {@code SAMPLE_COUNT * RECORD_SIZE}; {@code STORED_LENGTH} is what follows on disk.
 */
public record ChunkHeader(int signalId, long sampleCount, long rawLength, long storedLength,
                          double minTimestamp, double maxTimestamp) {

    public static final byte[] MAGIC = {'C', 'H', 'N', 'K'};
    public static final int SIZE = 4 + 4 + 4 + 4 + 4 + 8 + 8;
    public static final int RECORD_SIZE = 8 + 8;

    public static ChunkHeader from(ByteBuffer buf) {
        buf.order(ByteOrder.LITTLE_ENDIAN);
        if (buf.remaining() < SIZE)
            throw new IllegalArgumentException("Chunk header truncated: " + buf.remaining() + " bytes");
        byte[] magic = new byte[MAGIC.length];
        buf.get(magic);
        if (!Arrays.equals(magic, MAGIC))
            throw new IllegalArgumentException("Invalid chunk magic: " + Ascii.printable(magic));
        return new ChunkHeader(
                buf.getInt(),
                buf.getInt() & 0xFFFFFFFFL,
                buf.getInt() & 0xFFFFFFFFL,
                buf.getInt() & 0xFFFFFFFFL,
                buf.getDouble(),
                buf.getDouble());
    }
}
