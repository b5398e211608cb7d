/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server.http.dto;

/**
 * Error body for failed requests.
 *
 * @param reason machine-readable cause, e.g. {@code NOT_FOUND} or {@code BAD_INDEX}
 */
public record ErrorResponse(String error, String reason) {}
