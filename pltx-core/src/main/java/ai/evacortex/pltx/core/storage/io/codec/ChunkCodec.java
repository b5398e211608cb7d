/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage.io.codec;

import ai.evacortex.pltx.core.exceptions.ChunkDecodeException;
import ai.evacortex.pltx.core.storage.ChunkDescriptor;
import ai.evacortex.pltx.core.storage.io.format.ChunkHeader;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Decodes the stored payload of one chunk into samples.
 *
 * <p>
 * The payload is first inflated with the chunk's {@link Compression}, then read as
 * {@code sampleCount} little-endian records of {@code (timestamp f64, value f64)}.
 * </p>
 *
 * <h3>Safety</h3>
 * Every length is cross-checked against the {@link ChunkDescriptor}: a payload that
 * is shorter than declared, inflates to the wrong size, or does not hold exactly
 * {@code sampleCount} records is rejected with {@link ChunkDecodeException}. Nothing
 * is retried and no partial chunk is returned.
 *
 * <p>The codec holds no state and does no I/O; it is safe to call from any thread.</p>
 *
 * @see ChunkDescriptor
 * @see Compression
 */
public final class ChunkCodec {

    public static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;

    private ChunkCodec() {}

    public static DecodedChunk decode(byte[] stored, ChunkDescriptor descriptor) {
        if (stored.length != descriptor.storedLength()) {
            throw new ChunkDecodeException("payload at offset " + descriptor.payloadOffset() + " is "
                    + stored.length + " bytes, expected " + descriptor.storedLength());
        }

        int rawLength = descriptor.rawLength();
        byte[] raw = descriptor.compressed() ? descriptor.compression().inflate(stored, rawLength) : stored;
        if (raw.length != rawLength) {
            throw new ChunkDecodeException("payload at offset " + descriptor.payloadOffset()
                    + " inflated to " + (raw.length > rawLength ? "more than " + rawLength : raw.length)
                    + " bytes, expected " + rawLength);
        }

        int count = descriptor.sampleCount();
        if ((long) count * ChunkHeader.RECORD_SIZE != rawLength) {
            throw new ChunkDecodeException("sample count " + count + " does not match " + rawLength + " raw bytes");
        }

        ByteBuffer buf = ByteBuffer.wrap(raw).order(ORDER);
        double[] timestamps = new double[count];
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            timestamps[i] = buf.getDouble();
            values[i] = buf.getDouble();
        }
        return new DecodedChunk(timestamps, values);
    }
}
