/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.testkit;

import com.github.luben.zstd.ZstdOutputStream;
import net.jpountz.lz4.LZ4FrameOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.DeflaterOutputStream;

/**
 * Writes PLTX v2 fixture files for tests.
 *
 * <p>
 * The produced layout matches the recorder that creates real PLTX files:
 * </p>
 * <pre>
 *   [PREFIX: "PLTX" version(u8) compression(u8) created(f64) signalCount(u16)]
 *   [SIGNAL DEFINITIONS: id(u32) name unit description source (u16-length UTF-8)]
 *   [CHUNKS: "CHNK" id(u32) n(u32) rawLen(u32) storedLen(u32) minTs(f64) maxTs(f64) payload]
 *   [INDEX: "IDXT" count(u32) {id(u32) offset(u64) minTs(f64) maxTs(f64)}*]
 *   [FOOTER: "FTER" indexOffset(u64)]
 * </pre>
 *
 * <p>
 * Chunks are written in the order they were added, so interleaving signals is
 * simply a matter of call order. A few hooks deliberately break the file so that
 * readers can be tested against malformed input.
 * </p>
 */
public final class PltxFileBuilder {

    public static final int COMPRESSION_NONE = 0;
    public static final int COMPRESSION_ZLIB = 1;
    public static final int COMPRESSION_LZ4 = 2;
    public static final int COMPRESSION_ZSTD = 3;

    private static final byte[] MAGIC = ascii("PLTX");
    private static final byte[] CHUNK_MAGIC = ascii("CHNK");
    private static final byte[] INDEX_MAGIC = ascii("IDXT");
    private static final byte[] FOOTER_MAGIC = ascii("FTER");
    private static final int RECORD_SIZE = 16;

    private int version = 2;
    private int compression = COMPRESSION_NONE;
    private double created = 1_700_000_000.0;
    private final Map<Integer, String[]> signals = new LinkedHashMap<>();
    private final List<PendingChunk> chunks = new ArrayList<>();
    private int nextSignalId = 1;

    private record PendingChunk(int signalId, double[] timestamps, double[] values, boolean corruptPayload) {}

    public static PltxFileBuilder create() {
        return new PltxFileBuilder();
    }

    public PltxFileBuilder version(int version) {
        this.version = version;
        return this;
    }

    public PltxFileBuilder compression(int compression) {
        this.compression = compression;
        return this;
    }

    public PltxFileBuilder created(double created) {
        this.created = created;
        return this;
    }

    public PltxFileBuilder signal(String name) {
        return signal(name, "", "", "");
    }

    public PltxFileBuilder signal(String name, String unit, String description, String source) {
        signals.put(nextSignalId++, new String[]{name, unit, description, source});
        return this;
    }

    /** Appends one chunk for the named signal; timestamps and values are paired by position. */
    public PltxFileBuilder chunk(String name, double[] timestamps, double[] values) {
        return addChunk(name, timestamps, values, false);
    }

    /** Appends a chunk whose stored payload is garbage of the declared length. */
    public PltxFileBuilder corruptChunk(String name, double[] timestamps, double[] values) {
        return addChunk(name, timestamps, values, true);
    }

    /** Convenience for a ramp: {@code count} samples at {@code start, start + step, ...} with value = index. */
    public PltxFileBuilder rampChunk(String name, double start, double step, int count, double firstValue) {
        double[] ts = new double[count];
        double[] vs = new double[count];
        for (int i = 0; i < count; i++) {
            ts[i] = start + i * step;
            vs[i] = firstValue + i;
        }
        return chunk(name, ts, vs);
    }

    public byte[] toBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeHeader(out);

        List<Long> offsets = new ArrayList<>();
        for (PendingChunk chunk : chunks) {
            offsets.add((long) out.size());
            writeChunk(out, chunk);
        }

        long indexOffset = out.size();
        ByteBuffer index = le(8 + 28 * chunks.size());
        index.put(INDEX_MAGIC);
        index.putInt(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            PendingChunk chunk = chunks.get(i);
            index.putInt(chunk.signalId());
            index.putLong(offsets.get(i));
            index.putDouble(min(chunk.timestamps()));
            index.putDouble(max(chunk.timestamps()));
        }
        out.writeBytes(index.array());

        ByteBuffer footer = le(12);
        footer.put(FOOTER_MAGIC);
        footer.putLong(indexOffset);
        out.writeBytes(footer.array());
        return out.toByteArray();
    }

    public Path writeTo(Path path) {
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            Files.write(path, toBytes());
            return path;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write fixture " + path, e);
        }
    }

    /** Byte offset of the first chunk header, i.e. the end of the signal definitions. */
    public int headerLength() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeHeader(out);
        return out.size();
    }

    private PltxFileBuilder addChunk(String name, double[] timestamps, double[] values, boolean corrupt) {
        if (timestamps.length != values.length) {
            throw new IllegalArgumentException("timestamps and values differ in length");
        }
        int id = signalId(name);
        chunks.add(new PendingChunk(id, timestamps.clone(), values.clone(), corrupt));
        return this;
    }

    private int signalId(String name) {
        for (Map.Entry<Integer, String[]> e : signals.entrySet()) {
            if (e.getValue()[0].equals(name)) return e.getKey();
        }
        throw new IllegalArgumentException("Unknown signal: " + name);
    }

    private void writeHeader(ByteArrayOutputStream out) {
        ByteBuffer prefix = le(16);
        prefix.put(MAGIC);
        prefix.put((byte) version);
        prefix.put((byte) compression);
        prefix.putDouble(created);
        prefix.putShort((short) signals.size());
        out.writeBytes(prefix.array());

        for (Map.Entry<Integer, String[]> e : signals.entrySet()) {
            out.writeBytes(le(4).putInt(e.getKey()).array());
            for (String s : e.getValue()) writeString(out, s);
        }
    }

    private void writeChunk(ByteArrayOutputStream out, PendingChunk chunk) {
        int n = chunk.timestamps().length;
        ByteBuffer raw = le(n * RECORD_SIZE);
        for (int i = 0; i < n; i++) {
            raw.putDouble(chunk.timestamps()[i]);
            raw.putDouble(chunk.values()[i]);
        }
        byte[] stored = compress(raw.array());
        if (chunk.corruptPayload()) {
            stored = new byte[Math.max(stored.length, 8)];
            for (int i = 0; i < stored.length; i++) stored[i] = (byte) (0xA5 ^ i);
        }

        ByteBuffer header = le(4 + 32);
        header.put(CHUNK_MAGIC);
        header.putInt(chunk.signalId());
        header.putInt(n);
        header.putInt(raw.capacity());
        header.putInt(stored.length);
        header.putDouble(min(chunk.timestamps()));
        header.putDouble(max(chunk.timestamps()));
        out.writeBytes(header.array());
        out.writeBytes(stored);
    }

    private byte[] compress(byte[] raw) {
        if (compression == COMPRESSION_NONE) return raw;
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        try (OutputStream os = wrap(sink)) {
            os.write(raw);
        } catch (IOException e) {
            throw new UncheckedIOException("Fixture compression failed", e);
        }
        return sink.toByteArray();
    }

    private OutputStream wrap(OutputStream sink) throws IOException {
        return switch (compression) {
            case COMPRESSION_ZLIB -> new DeflaterOutputStream(sink);
            case COMPRESSION_LZ4 -> new LZ4FrameOutputStream(sink);
            case COMPRESSION_ZSTD -> new ZstdOutputStream(sink);
            default -> throw new IllegalStateException("No compressor for code " + compression);
        };
    }

    private static void writeString(ByteArrayOutputStream out, String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        out.writeBytes(le(2).putShort((short) bytes.length).array());
        out.writeBytes(bytes);
    }

    private static double min(double[] xs) {
        double m = Double.POSITIVE_INFINITY;
        for (double x : xs) m = Math.min(m, x);
        return xs.length == 0 ? 0.0 : m;
    }

    private static double max(double[] xs) {
        double m = Double.NEGATIVE_INFINITY;
        for (double x : xs) m = Math.max(m, x);
        return xs.length == 0 ? 0.0 : m;
    }

    private static ByteBuffer le(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }
}
