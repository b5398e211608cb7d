/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server.http;

import ai.evacortex.pltx.server.http.dto.HealthResponse;
import ai.evacortex.pltx.server.http.dto.ServiceInfo;
import io.javalin.Javalin;
import io.javalin.http.Context;

/**
 * Liveness, service descriptor and process stop endpoints. {@code GET /stop} answers
 * first and leaves the actual shutdown to {@code stopAction}, which must not block
 * the request thread.
 */
public final class HealthController {

    private final ServiceInfo info;
    private final Runnable stopAction;

    public HealthController(ServiceInfo info, Runnable stopAction) {
        this.info = info;
        this.stopAction = stopAction;
    }

    public void registerRoutes(Javalin app) {
        app.get("/health", this::health);
        app.get("/info", this::info);
        app.get("/stop", this::stop);
    }

    private void health(Context ctx) {
        ctx.json(HealthResponse.OK);
    }

    private void info(Context ctx) {
        ctx.json(info);
    }

    private void stop(Context ctx) {
        ctx.json(HealthResponse.STOPPING);
        stopAction.run();
    }
}
