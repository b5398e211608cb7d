/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage.io.format;

import ai.evacortex.pltx.core.storage.io.codec.Compression;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * FileHeader describes the leading block of a PLTX file: the fixed prefix and the
 * signal definitions that follow it.
 *
 * <h3>Layout</h3>
 * <pre>
 *   [MAGIC "PLTX" (4)] [VERSION u8] [COMPRESSION u8] [CREATED f64] [SIGNAL_COUNT u16]
 *   SIGNAL_COUNT x [SIGNAL_ID u32] [NAME] [UNIT] [DESCRIPTION] [SOURCE]
 * </pre>
 * Strings are a little-endian u16 byte length followed by UTF-8 bytes.
 *
 * <p>
 * The header does not carry the index location; that comes from the {@link Footer}
 * and is attached here so that one object answers "where is everything".
 * </p>
 *
 * <p>
 * Parsing is strict: an unknown version or compression code is rejected rather
 * than guessed at, and malformed strings fail the whole header.
 * </p>
 *
 * @see Footer
 * @see IndexEntry
 */
public final class FileHeader {

    public static final byte[] MAGIC = {'P', 'L', 'T', 'X'};
    public static final int MAGIC_LENGTH = 4;
    public static final int PREFIX_SIZE = MAGIC_LENGTH + 1 + 1 + 8 + 2;

    private final int version;
    private final Compression compression;
    private final double created;
    private final List<SignalDefinition> signals;
    private final long indexOffset;
    private final long indexLength;

    public record SignalDefinition(int id, String name, String unit, String description, String source) {}

    public FileHeader(int version, Compression compression, double created,
                      List<SignalDefinition> signals, long indexOffset, long indexLength) {
        this.version = version;
        this.compression = compression;
        this.created = created;
        this.signals = Collections.unmodifiableList(new ArrayList<>(signals));
        this.indexOffset = indexOffset;
        this.indexLength = indexLength;
    }

    private record Prefix(int version, Compression compression, double created, int signalCount) {}

    /**
     * Validates the fixed 16-byte prefix only: magic, version and compression code.
     *
     * @throws IllegalArgumentException if the prefix is not one this reader accepts
     */
    public static void verifyPrefix(ByteBuffer buf, Set<Integer> supportedVersions) {
        readPrefix(buf, supportedVersions);
    }

    /**
     * Parses the prefix and signal definitions from {@code buf}, which must start at
     * file offset 0 and may extend past the definitions.
     *
     * @throws IllegalArgumentException on bad magic, unsupported version or compression,
     *                                  or definitions that do not fit in the buffer
     */
    public static FileHeader from(ByteBuffer buf, Set<Integer> supportedVersions, Footer footer, IndexTable index) {
        Prefix prefix = readPrefix(buf, supportedVersions);
        int count = prefix.signalCount();

        List<SignalDefinition> signals = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            if (buf.remaining() < 4)
                throw new IllegalArgumentException("Signal definition " + i + " truncated");
            int id = buf.getInt();
            String name = readString(buf);
            String unit = readString(buf);
            String description = readString(buf);
            String source = readString(buf);
            signals.add(new SignalDefinition(id, name, unit, description, source));
        }

        return new FileHeader(prefix.version(), prefix.compression(), prefix.created(), signals,
                footer.indexOffset(), index.byteLength());
    }

    private static Prefix readPrefix(ByteBuffer buf, Set<Integer> supportedVersions) {
        buf.order(ByteOrder.LITTLE_ENDIAN);
        if (buf.remaining() < PREFIX_SIZE)
            throw new IllegalArgumentException("Header truncated: " + buf.remaining() + " bytes");

        byte[] magic = new byte[MAGIC_LENGTH];
        buf.get(magic);
        if (!Arrays.equals(magic, MAGIC))
            throw new IllegalArgumentException("Invalid magic: " + Ascii.printable(magic));

        int version = buf.get() & 0xFF;
        if (!supportedVersions.contains(version))
            throw new IllegalArgumentException("Unsupported version: " + version);

        int code = buf.get() & 0xFF;
        Compression compression = Compression.fromCode(code)
                .orElseThrow(() -> new IllegalArgumentException("Unknown compression code: " + code));

        double created = buf.getDouble();
        int count = buf.getShort() & 0xFFFF;
        return new Prefix(version, compression, created, count);
    }

    private static String readString(ByteBuffer buf) {
        if (buf.remaining() < 2)
            throw new IllegalArgumentException("String length truncated at " + buf.position());
        int len = buf.getShort() & 0xFFFF;
        if (buf.remaining() < len)
            throw new IllegalArgumentException("String of " + len + " bytes truncated at " + buf.position());
        ByteBuffer slice = buf.slice();
        slice.limit(len);
        buf.position(buf.position() + len);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(slice)
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Invalid UTF-8 string", e);
        }
    }

    public int version()                      { return version; }
    public Compression compression()          { return compression; }
    public double created()                   { return created; }
    public int signalCount()                  { return signals.size(); }
    public List<SignalDefinition> signals()   { return signals; }
    public long indexOffset()                 { return indexOffset; }
    public long indexLength()                 { return indexLength; }
}
