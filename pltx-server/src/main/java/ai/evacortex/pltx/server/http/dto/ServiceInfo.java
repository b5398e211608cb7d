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

/** Service descriptor returned by {@code GET /info}. */
public record ServiceInfo(String name,
                          String id,
                          String version,
                          String description,
                          String mode,
                          @JsonProperty("file_formats") List<String> fileFormats) {}
