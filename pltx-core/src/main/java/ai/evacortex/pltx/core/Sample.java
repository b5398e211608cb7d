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
 * One recorded point of a signal. The reader does not enforce timestamp monotonicity;
 * it trusts the chunk order of the file.
 */
public record Sample(double timestamp, double value) {}
