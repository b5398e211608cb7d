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

import java.util.List;

/** One entry of {@code GET /readers}; {@code headers} are the names stored in the file. */
public record ReaderSummary(String id,
                            String name,
                            String path,
                            @JsonProperty("signals_count") int signalsCount,
                            List<String> headers) {}
