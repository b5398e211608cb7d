/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.exceptions;

public class ChunkDecodeException extends PltxException {
    public ChunkDecodeException(String message) {
        super("Corrupt chunk: " + message);
    }

    public ChunkDecodeException(String message, Throwable cause) {
        super("Corrupt chunk: " + message, cause);
    }
}
