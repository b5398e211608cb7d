/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server.http.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata of one signal. Times are {@code null} for a signal without samples.
 */
public record SignalResponse(String name,
                             @JsonProperty("internal_name") String internalName,
                             String unit,
                             String description,
                             String source,
                             @JsonProperty("sample_count") long sampleCount,
                             @JsonProperty("start_time") Double startTime,
                             @JsonProperty("end_time") Double endTime) {}
