/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage;

import ai.evacortex.pltx.core.SignalMetadata;
import ai.evacortex.pltx.core.exceptions.PltxOpenException;
import ai.evacortex.pltx.core.exceptions.PltxOpenException.Reason;
import ai.evacortex.pltx.core.storage.io.FileHandle;
import ai.evacortex.pltx.core.storage.io.codec.Compression;
import ai.evacortex.pltx.core.storage.io.format.ChunkHeader;
import ai.evacortex.pltx.core.storage.io.format.FileHeader;
import ai.evacortex.pltx.core.storage.io.format.FileHeader.SignalDefinition;
import ai.evacortex.pltx.core.storage.io.format.Footer;
import ai.evacortex.pltx.core.storage.io.format.IndexEntry;
import ai.evacortex.pltx.core.storage.io.format.IndexTable;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the {@link SignalIndex} of a file from its footer, index table, header and
 * chunk headers. Chunk payloads are never read here.
 *
 * <p>
 * Validation runs in file-structure order so that the reported reason names the
 * first broken region: prefix, footer, index table, signal definitions, then each
 * chunk header. Any structural problem fails the whole open; there is no partial
 * index.
 * </p>
 */
final class IndexLoader {

    /** Upper bound for a single chunk payload, stored or raw. */
    static final int MAX_CHUNK_BYTES = 1 << 28;

    record Loaded(FileHeader header, SignalIndex index) {}

    private final Path path;
    private final FileHandle file;
    private final Set<Integer> supportedVersions;

    IndexLoader(Path path, FileHandle file, Set<Integer> supportedVersions) {
        this.path = path;
        this.file = file;
        this.supportedVersions = supportedVersions;
    }

    Loaded load() throws IOException {
        long size = file.size();
        if (size < FileHeader.PREFIX_SIZE + Footer.SIZE) {
            throw new PltxOpenException(Reason.BAD_HEADER, path,
                    "file is " + size + " bytes, too short for a PLTX container");
        }

        try {
            FileHeader.verifyPrefix(file.readBuffer(0, FileHeader.PREFIX_SIZE), supportedVersions);
        } catch (IllegalArgumentException e) {
            throw new PltxOpenException(Reason.BAD_HEADER, path, e.getMessage(), e);
        }

        long indexEnd = size - Footer.SIZE;
        Footer footer;
        IndexTable table;
        try {
            footer = Footer.from(file.readBuffer(indexEnd, Footer.SIZE));
            long indexOffset = footer.indexOffset();
            if (indexOffset < FileHeader.PREFIX_SIZE || indexOffset > indexEnd - IndexTable.PREAMBLE_SIZE) {
                throw new IllegalArgumentException("Index offset " + indexOffset + " outside ["
                        + FileHeader.PREFIX_SIZE + ", " + (indexEnd - IndexTable.PREAMBLE_SIZE) + "]");
            }
            table = IndexTable.from(file.readBuffer(indexOffset, checkedLength(indexEnd - indexOffset, "index")));
        } catch (IllegalArgumentException | BufferUnderflowException e) {
            throw new PltxOpenException(Reason.BAD_INDEX, path, message(e), e);
        }

        long headerEnd = footer.indexOffset();
        for (IndexEntry entry : table.entries()) {
            headerEnd = Math.min(headerEnd, entry.chunkOffset());
        }
        if (headerEnd < FileHeader.PREFIX_SIZE) {
            throw new PltxOpenException(Reason.BAD_INDEX, path,
                    "chunk offset " + headerEnd + " points into the file prefix");
        }

        FileHeader header;
        try {
            header = FileHeader.from(file.readBuffer(0, checkedLength(headerEnd, "header")),
                    supportedVersions, footer, table);
            checkDefinitions(header.signals());
        } catch (IllegalArgumentException | BufferUnderflowException e) {
            throw new PltxOpenException(Reason.BAD_HEADER, path, message(e), e);
        }

        try {
            return new Loaded(header, buildIndex(header, table));
        } catch (IllegalArgumentException | BufferUnderflowException e) {
            throw new PltxOpenException(Reason.BAD_INDEX, path, message(e), e);
        }
    }

    private SignalIndex buildIndex(FileHeader header, IndexTable table) throws IOException {
        Map<Integer, List<ChunkDescriptor>> chunksById = new LinkedHashMap<>();
        for (SignalDefinition def : header.signals()) {
            chunksById.put(def.id(), new ArrayList<>());
        }

        Compression compression = header.compression();
        long indexOffset = header.indexOffset();
        for (IndexEntry entry : table.entries()) {
            List<ChunkDescriptor> chunks = chunksById.get(entry.signalId());
            if (chunks == null) {
                throw new IllegalArgumentException("Index entry references unknown signal id " + entry.signalId());
            }
            long offset = entry.chunkOffset();
            if (offset > indexOffset - ChunkHeader.SIZE) {
                throw new IllegalArgumentException("Chunk header at " + offset + " overlaps the index");
            }

            ChunkHeader ch = ChunkHeader.from(file.readBuffer(offset, ChunkHeader.SIZE));
            if (ch.signalId() != entry.signalId()) {
                throw new IllegalArgumentException("Chunk at " + offset + " belongs to signal " + ch.signalId()
                        + ", index says " + entry.signalId());
            }
            if (ch.rawLength() > MAX_CHUNK_BYTES || ch.storedLength() > MAX_CHUNK_BYTES) {
                throw new IllegalArgumentException("Chunk at " + offset + " exceeds " + MAX_CHUNK_BYTES + " bytes");
            }
            if (ch.sampleCount() * ChunkHeader.RECORD_SIZE != ch.rawLength()) {
                throw new IllegalArgumentException("Chunk at " + offset + " declares " + ch.sampleCount()
                        + " samples but " + ch.rawLength() + " raw bytes");
            }
            if (compression == Compression.NONE && ch.storedLength() != ch.rawLength()) {
                throw new IllegalArgumentException("Uncompressed chunk at " + offset + " stores "
                        + ch.storedLength() + " bytes for " + ch.rawLength() + " raw bytes");
            }
            long payloadOffset = offset + ChunkHeader.SIZE;
            if (payloadOffset + ch.storedLength() > indexOffset) {
                throw new IllegalArgumentException("Chunk payload at " + payloadOffset + " runs into the index");
            }

            ChunkDescriptor descriptor = new ChunkDescriptor(entry.signalId(), offset, payloadOffset,
                    (int) ch.storedLength(), (int) ch.rawLength(), (int) ch.sampleCount(),
                    entry.minTimestamp(), entry.maxTimestamp(), compression);
            if (!chunks.isEmpty()) {
                ChunkDescriptor last = chunks.get(chunks.size() - 1);
                if (!(descriptor.startTime() > last.startTime())) {
                    throw new IllegalArgumentException("Chunk start times of signal " + entry.signalId()
                            + " are not strictly increasing: " + last.startTime() + " then " + descriptor.startTime());
                }
            }
            chunks.add(descriptor);
        }

        List<SignalIndex.Entry> entries = new ArrayList<>(header.signalCount());
        for (SignalDefinition def : header.signals()) {
            List<ChunkDescriptor> chunks = chunksById.get(def.id());
            entries.add(new SignalIndex.Entry(def.id(), summarize(def, chunks), chunks));
        }
        return new SignalIndex(entries);
    }

    private static SignalMetadata summarize(SignalDefinition def, List<ChunkDescriptor> chunks) {
        long samples = 0;
        double start = Double.NaN;
        double end = Double.NaN;
        for (ChunkDescriptor c : chunks) {
            samples += c.sampleCount();
            if (c.sampleCount() == 0) continue;
            start = Double.isNaN(start) ? c.startTime() : Math.min(start, c.startTime());
            end = Double.isNaN(end) ? c.endTime() : Math.max(end, c.endTime());
        }
        return new SignalMetadata(def.name(), def.unit(), def.description(), def.source(), samples, start, end);
    }

    private static void checkDefinitions(List<SignalDefinition> defs) {
        Set<Integer> ids = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (SignalDefinition def : defs) {
            if (def.name().isEmpty())
                throw new IllegalArgumentException("Signal " + def.id() + " has an empty name");
            if (!ids.add(def.id()))
                throw new IllegalArgumentException("Duplicate signal id " + def.id());
            if (!names.add(def.name()))
                throw new IllegalArgumentException("Duplicate signal name '" + def.name() + "'");
        }
    }

    private static int checkedLength(long length, String region) {
        if (length > Integer.MAX_VALUE)
            throw new IllegalArgumentException("The " + region + " region of " + length + " bytes is too large");
        return (int) length;
    }

    private static String message(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : "truncated structure";
    }
}
