/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage;

import ai.evacortex.pltx.core.storage.io.codec.Compression;

/**
 * Location and shape of one chunk, as established when the index is loaded.
 *
 * @param signalId      id of the owning signal within its file
 * @param chunkOffset   file offset of the chunk header
 * @param payloadOffset file offset of the stored payload
 * @param storedLength  payload bytes on disk
 * @param rawLength     payload bytes after inflation
 * @param sampleCount   number of records in the payload
 * @param startTime     smallest timestamp in the chunk, from the index
 * @param endTime       largest timestamp in the chunk, from the index
 * @param compression   codec of the payload
 */
public record ChunkDescriptor(int signalId, long chunkOffset, long payloadOffset,
                              int storedLength, int rawLength, int sampleCount,
                              double startTime, double endTime, Compression compression) {

    public boolean compressed() {
        return compression != Compression.NONE;
    }

    /** True when the chunk may contain samples inside {@code [from, to]}. */
    public boolean overlaps(double from, double to) {
        return !(endTime < from || startTime > to);
    }
}
