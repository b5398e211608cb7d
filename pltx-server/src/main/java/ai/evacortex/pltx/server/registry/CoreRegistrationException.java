/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server.registry;

/** The core service could not be reached or refused the registration. */
public class CoreRegistrationException extends RuntimeException {

    public CoreRegistrationException(String message) {
        super(message);
    }

    public CoreRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
