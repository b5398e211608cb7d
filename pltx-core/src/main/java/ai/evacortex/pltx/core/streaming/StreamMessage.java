/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.streaming;

import ai.evacortex.pltx.core.Sample;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One message of a signal stream. Data messages carry a sample and its 0-based
 * sequence number; the single closing message has {@code endFlag} set and a
 * {@code seq} equal to the number of data messages before it.
 *
 * @param desc reserved, always empty
 */
public record StreamMessage(double timestamp, double value, String desc, long seq,
                            @JsonProperty("end_flag") boolean endFlag) {

    public static StreamMessage data(Sample sample, long seq) {
        return new StreamMessage(sample.timestamp(), sample.value(), "", seq, false);
    }

    public static StreamMessage end(long seq, double lastTimestamp, double lastValue) {
        return new StreamMessage(lastTimestamp, lastValue, "", seq, true);
    }
}
