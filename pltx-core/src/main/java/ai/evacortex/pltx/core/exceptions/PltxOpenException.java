/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.exceptions;

import java.nio.file.Path;

/**
 * Raised when a PLTX file cannot be opened. The {@link Reason} tells the boundary
 * layer whether the file was missing, structurally broken, or unreadable.
 */
public class PltxOpenException extends PltxException {

    public enum Reason {
        NOT_FOUND,
        BAD_HEADER,
        BAD_INDEX,
        IO_ERROR
    }

    private final Reason reason;
    private final Path path;

    public PltxOpenException(Reason reason, Path path, String message) {
        super(describe(reason, path, message));
        this.reason = reason;
        this.path = path;
    }

    public PltxOpenException(Reason reason, Path path, String message, Throwable cause) {
        super(describe(reason, path, message), cause);
        this.reason = reason;
        this.path = path;
    }

    public Reason reason() {
        return reason;
    }

    public Path path() {
        return path;
    }

    private static String describe(Reason reason, Path path, String message) {
        return "Cannot open " + path + " (" + reason + "): " + message;
    }
}
