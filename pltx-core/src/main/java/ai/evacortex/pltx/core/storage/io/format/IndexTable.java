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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The index region of a PLTX file.
 *
 * <pre>
 *   [MAGIC "IDXT" (4)] [ENTRY_COUNT u32] ENTRY_COUNT x {@link IndexEntry}
 * </pre>
 *
 * The region runs from the footer's index offset up to the footer itself and must be
 * exactly as long as its entry count says; trailing or missing bytes mean the file
 * was not sealed correctly.
 */
public final class IndexTable {

    public static final byte[] MAGIC = {'I', 'D', 'X', 'T'};
    public static final int PREAMBLE_SIZE = 4 + 4;

    private final List<IndexEntry> entries;
    private final long byteLength;

    private IndexTable(List<IndexEntry> entries, long byteLength) {
        this.entries = Collections.unmodifiableList(entries);
        this.byteLength = byteLength;
    }

    public static IndexTable from(ByteBuffer buf) {
        buf.order(ByteOrder.LITTLE_ENDIAN);
        int regionLength = buf.remaining();
        if (regionLength < PREAMBLE_SIZE)
            throw new IllegalArgumentException("Index truncated: " + regionLength + " bytes");

        byte[] magic = new byte[MAGIC.length];
        buf.get(magic);
        if (!Arrays.equals(magic, MAGIC))
            throw new IllegalArgumentException("Invalid index magic: " + Ascii.printable(magic));

        long count = buf.getInt() & 0xFFFFFFFFL;
        long expected = PREAMBLE_SIZE + count * IndexEntry.SIZE;
        if (expected != regionLength)
            throw new IllegalArgumentException("Index declares " + count + " entries (" + expected
                    + " bytes) but region holds " + regionLength + " bytes");

        List<IndexEntry> entries = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) {
            entries.add(new IndexEntry(buf.getInt(), buf.getLong(), buf.getDouble(), buf.getDouble()));
        }
        return new IndexTable(entries, regionLength);
    }

    public List<IndexEntry> entries() {
        return entries;
    }

    public long byteLength() {
        return byteLength;
    }
}
