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
import com.github.luben.zstd.ZstdInputStream;
import net.jpountz.lz4.LZ4FrameInputStream;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Optional;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Compression codes of the PLTX container. The code is declared once in the file
 * header and applies to every chunk payload.
 *
 * <p>LZ4 payloads use the LZ4 frame format, ZSTD payloads are standard zstd frames
 * and ZLIB payloads carry the zlib wrapper.</p>
 */
public enum Compression {

    NONE(0) {
        @Override
        public byte[] inflate(byte[] stored, int rawLength) {
            return stored;
        }
    },

    ZLIB(1) {
        @Override
        public byte[] inflate(byte[] stored, int rawLength) {
            Inflater inflater = new Inflater();
            try {
                inflater.setInput(stored);
                byte[] out = new byte[rawLength];
                int produced = 0;
                while (produced < rawLength && !inflater.finished()) {
                    int n = inflater.inflate(out, produced, rawLength - produced);
                    if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                        throw new ChunkDecodeException("zlib stream truncated after " + produced + " bytes");
                    }
                    produced += n;
                }
                if (!inflater.finished()) {
                    byte[] probe = new byte[1];
                    if (inflater.inflate(probe) > 0 || !inflater.finished()) {
                        throw new ChunkDecodeException("zlib stream does not end after " + rawLength + " bytes");
                    }
                }
                return produced == rawLength ? out : Arrays.copyOf(out, produced);
            } catch (DataFormatException e) {
                throw new ChunkDecodeException("zlib: " + e.getMessage(), e);
            } finally {
                inflater.end();
            }
        }
    },

    LZ4(2) {
        @Override
        public byte[] inflate(byte[] stored, int rawLength) {
            try (InputStream in = new LZ4FrameInputStream(new ByteArrayInputStream(stored))) {
                return readBounded(in, rawLength);
            } catch (IOException | RuntimeException e) {
                throw new ChunkDecodeException("lz4: " + e.getMessage(), e);
            }
        }
    },

    ZSTD(3) {
        @Override
        public byte[] inflate(byte[] stored, int rawLength) {
            try (InputStream in = new ZstdInputStream(new ByteArrayInputStream(stored))) {
                return readBounded(in, rawLength);
            } catch (IOException | RuntimeException e) {
                throw new ChunkDecodeException("zstd: " + e.getMessage(), e);
            }
        }
    };

    private final int code;

    Compression(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Inflates a stored payload to {@code rawLength} bytes. A stream that disagrees
     * with the chunk header yields a shorter array, or one byte more than requested;
     * callers compare lengths and report the mismatch.
     *
     * @throws ChunkDecodeException if the compressed stream is corrupt
     */
    public abstract byte[] inflate(byte[] stored, int rawLength);

    public static Optional<Compression> fromCode(int code) {
        for (Compression c : values()) {
            if (c.code == code) return Optional.of(c);
        }
        return Optional.empty();
    }

    /** Reads at most {@code expected + 1} bytes so that an oversized stream is detectable without inflating all of it. */
    private static byte[] readBounded(InputStream in, int expected) throws IOException {
        byte[] out = new byte[expected + 1];
        int produced = 0;
        while (produced < out.length) {
            int n = in.read(out, produced, out.length - produced);
            if (n < 0) break;
            produced += n;
        }
        return produced == out.length ? out : Arrays.copyOf(out, produced);
    }
}
