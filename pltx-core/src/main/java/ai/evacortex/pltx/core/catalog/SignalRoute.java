/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.catalog;

/** Binding of one catalog-wide signal name to a signal inside a registered file. */
public record SignalRoute(String publicName, String internalName, RegisteredFile file) {}
