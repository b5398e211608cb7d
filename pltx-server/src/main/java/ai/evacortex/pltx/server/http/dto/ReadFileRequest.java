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
 * Body of {@code POST /read-file}.
 *
 * @param mode {@code offline} to read a recorded file; {@code online} is rejected
 * @param path file system path of the PLTX file, as seen by the server
 */
public record ReadFileRequest(String mode, String path) {}
