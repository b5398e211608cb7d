/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server.http;

import ai.evacortex.pltx.core.catalog.SignalCatalog;
import ai.evacortex.pltx.core.exceptions.SignalNotFoundException;
import ai.evacortex.pltx.core.storage.SignalCursor;
import ai.evacortex.pltx.core.streaming.StreamOutcome;
import ai.evacortex.pltx.core.streaming.StreamingSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.BadRequestResponse;
import io.javalin.http.Context;
import io.javalin.http.NotFoundResponse;
import io.javalin.http.ServiceUnavailableResponse;
import io.javalin.websocket.WsConnectContext;
import io.javalin.websocket.WsContext;
import org.eclipse.jetty.websocket.api.StatusCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * WebSocket endpoint {@code /fetch/{signal}} streaming one registered signal.
 *
 * <p>
 * Unknown signal names are rejected during the HTTP upgrade with 404, before any
 * message is sent, and so is any upgrade once {@code maxStreams} streams are
 * running (503). An accepted connection gets its own {@link StreamingSession},
 * run on a worker of its own; the Jetty callback thread is never blocked by a
 * stream. The optional {@code from} and {@code to} query parameters restrict the
 * stream to a time window.
 * </p>
 *
 * <p>
 * A client closing the socket cancels its session, which then closes its cursor and
 * gives back its reader reference.
 * </p>
 */
public final class StreamController {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamController.class);

    static final String PATH = "/fetch/{signal}";

    private final SignalCatalog catalog;
    private final ExecutorService workers;
    private final ObjectMapper mapper;
    private final int maxStreams;
    private final Map<String, StreamingSession> active = new ConcurrentHashMap<>();

    /**
     * @param workers must start a thread for every submitted stream without queueing
     */
    public StreamController(SignalCatalog catalog, ExecutorService workers, ObjectMapper mapper, int maxStreams) {
        this.catalog = catalog;
        this.workers = workers;
        this.mapper = mapper;
        this.maxStreams = maxStreams;
    }

    public void registerRoutes(Javalin app) {
        app.wsBeforeUpgrade(PATH, this::beforeUpgrade);
        app.ws(PATH, ws -> {
            ws.onConnect(this::onConnect);
            ws.onClose(ctx -> cancel(ctx));
            ws.onError(ctx -> cancel(ctx));
        });
    }

    /** Number of streams currently running. */
    public int activeStreams() {
        return active.size();
    }

    private void beforeUpgrade(Context ctx) {
        String signal = ctx.pathParam("signal");
        TimeWindow.parse(ctx.queryParam("from"), ctx.queryParam("to"));
        if (!catalog.contains(signal)) {
            LOGGER.warn("Rejected stream of unknown signal '{}'", signal);
            throw new NotFoundResponse("Signal '" + signal + "' is not registered");
        }
        if (active.size() >= maxStreams) {
            LOGGER.warn("Rejected stream of '{}': {} streams already running", signal, active.size());
            throw new ServiceUnavailableResponse("Too many concurrent streams");
        }
    }

    private void onConnect(WsConnectContext ctx) {
        String signal = ctx.pathParam("signal");
        SignalCursor cursor;
        try {
            TimeWindow window = TimeWindow.parse(ctx.queryParam("from"), ctx.queryParam("to"));
            cursor = window.unbounded()
                    ? catalog.openCursor(signal)
                    : catalog.openCursor(signal, window.from(), window.to());
        } catch (SignalNotFoundException e) {
            // unregistered between upgrade and connect
            LOGGER.warn("Signal '{}' disappeared before the stream started", signal);
            ctx.session.close(StatusCode.POLICY_VIOLATION, WsStreamChannel.truncate(e.getMessage()));
            return;
        } catch (BadRequestResponse e) {
            ctx.session.close(StatusCode.POLICY_VIOLATION, WsStreamChannel.truncate(e.getMessage()));
            return;
        }

        String id = ctx.sessionId();
        StreamingSession session = new StreamingSession(signal, cursor, new WsStreamChannel(ctx.session, mapper));
        active.put(id, session);
        try {
            workers.submit(() -> run(id, session));
        } catch (RejectedExecutionException e) {
            active.remove(id, session);
            cursor.close();
            LOGGER.warn("Stream of '{}' rejected, server is shutting down", signal);
            ctx.session.close(StatusCode.SHUTDOWN, "server shutting down");
        }
    }

    private void run(String id, StreamingSession session) {
        try {
            StreamOutcome outcome = session.run();
            LOGGER.debug("Stream {} of '{}' finished: {}", id, session.signal(), outcome);
        } finally {
            active.remove(id, session);
        }
    }

    private void cancel(WsContext ctx) {
        StreamingSession session = active.get(ctx.sessionId());
        if (session != null) session.cancel();
    }

    /** Optional {@code [from, to]} bounds of a stream; both missing means the whole signal. */
    record TimeWindow(double from, double to, boolean unbounded) {

        static TimeWindow parse(String from, String to) {
            if (from == null && to == null) {
                return new TimeWindow(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, true);
            }
            double lo = from == null ? Double.NEGATIVE_INFINITY : parseBound("from", from);
            double hi = to == null ? Double.POSITIVE_INFINITY : parseBound("to", to);
            if (lo > hi) throw new BadRequestResponse("'from' must not be greater than 'to'");
            return new TimeWindow(lo, hi, false);
        }

        private static double parseBound(String name, String raw) {
            try {
                double v = Double.parseDouble(raw);
                if (Double.isNaN(v)) throw new NumberFormatException("NaN");
                return v;
            } catch (NumberFormatException e) {
                throw new BadRequestResponse("Invalid '" + name + "': " + raw);
            }
        }
    }
}
