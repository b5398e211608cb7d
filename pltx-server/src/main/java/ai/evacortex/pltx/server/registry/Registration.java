/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server.registry;

import ai.evacortex.pltx.server.http.dto.ServiceInfo;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Body of {@code POST /register}: the service descriptor plus where to reach it. */
public record Registration(String name,
                           String id,
                           String version,
                           String description,
                           String mode,
                           @JsonProperty("file_formats") List<String> fileFormats,
                           Connection connection) {

    public record Connection(String ip,
                             int port,
                             String target,
                             @JsonProperty("target_port") int targetPort) {}

    static Registration of(ServiceInfo service, String host, int port, String target, int targetPort) {
        return new Registration(service.name(), service.id(), service.version(), service.description(),
                service.mode(), service.fileFormats(), new Connection(host, port, target, targetPort));
    }
}
