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

/**
 * Metadata of a file registered through {@code POST /read-file}. {@code headers} are
 * the public signal names to stream the file's signals under.
 */
public record ReadFileResponse(String id,
                               String name,
                               String path,
                               String source,
                               List<String> headers,
                               String desc,
                               List<String> tags,
                               @JsonProperty("created_at") String createdAt,
                               @JsonProperty("source_url") String sourceUrl) {}
