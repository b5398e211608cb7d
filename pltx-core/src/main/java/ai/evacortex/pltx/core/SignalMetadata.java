/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core;

/**
 * Descriptive data of one signal in one file, fixed when the file's index is built.
 *
 * <p>{@code sampleCount}, {@code startTime} and {@code endTime} are derived from the
 * chunk index. A signal without chunks has zero samples and a {@code NaN} time range.</p>
 *
 * @param name        internal name as stored in the file; unique within the file only
 * @param unit        physical unit, may be empty
 * @param description free text, may be empty
 * @param source      tag of the recorder or bus the signal came from, may be empty
 */
public record SignalMetadata(String name, String unit, String description, String source,
                             long sampleCount, double startTime, double endTime) {

    public boolean isEmpty() {
        return sampleCount == 0;
    }
}
