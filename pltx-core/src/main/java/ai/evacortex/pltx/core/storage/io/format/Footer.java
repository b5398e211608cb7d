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
 * The trailing 12 bytes of a PLTX file: {@code [MAGIC "FTER" (4)] [INDEX_OFFSET u64]}.
 */
public record Footer(long indexOffset) {

    public static final byte[] MAGIC = {'F', 'T', 'E', 'R'};
    public static final int SIZE = 4 + 8;

    public static Footer from(ByteBuffer buf) {
        buf.order(ByteOrder.LITTLE_ENDIAN);
        if (buf.remaining() < SIZE)
            throw new IllegalArgumentException("Footer truncated: " + buf.remaining() + " bytes");
        byte[] magic = new byte[MAGIC.length];
        buf.get(magic);
        if (!Arrays.equals(magic, MAGIC))
            throw new IllegalArgumentException("Invalid footer magic: " + Ascii.printable(magic));
        return new Footer(buf.getLong());
    }
}
