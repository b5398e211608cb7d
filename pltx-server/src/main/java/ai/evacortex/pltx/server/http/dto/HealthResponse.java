/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server.http.dto;

public record HealthResponse(String status) {

    public static final HealthResponse OK = new HealthResponse("ok");
    public static final HealthResponse STOPPING = new HealthResponse("stopping");
}
