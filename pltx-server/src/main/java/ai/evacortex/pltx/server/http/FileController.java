/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server.http;

import ai.evacortex.pltx.core.SignalMetadata;
import ai.evacortex.pltx.core.catalog.RegisteredFile;
import ai.evacortex.pltx.core.catalog.SignalCatalog;
import ai.evacortex.pltx.core.exceptions.PltxOpenException;
import ai.evacortex.pltx.core.storage.PltxReader;
import ai.evacortex.pltx.core.storage.ReaderOptions;
import ai.evacortex.pltx.server.http.dto.ErrorResponse;
import ai.evacortex.pltx.server.http.dto.HeadersResponse;
import ai.evacortex.pltx.server.http.dto.ReadFileRequest;
import ai.evacortex.pltx.server.http.dto.ReadFileResponse;
import ai.evacortex.pltx.server.http.dto.ReaderSummary;
import ai.evacortex.pltx.server.http.dto.SignalResponse;
import io.javalin.Javalin;
import io.javalin.http.BadRequestResponse;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.http.NotFoundResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * HTTP controller for registering PLTX files and inspecting registered ones.
 *
 * <p>
 * {@code POST /read-file} opens a file and registers all of its signals in the shared
 * {@link SignalCatalog}; the response lists the public names under which they can be
 * streamed from {@code /fetch/{signal}}. Open failures map to 404 (missing file), 422
 * (malformed file) or 500 (I/O error).
 * </p>
 */
public final class FileController {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileController.class);

    static final String MODE_OFFLINE = "offline";
    static final String MODE_ONLINE = "online";
    static final int UNPROCESSABLE = 422;

    private final SignalCatalog catalog;
    private final ReaderOptions readerOptions;

    public FileController(SignalCatalog catalog, ReaderOptions readerOptions) {
        this.catalog = catalog;
        this.readerOptions = readerOptions;
    }

    public void registerRoutes(Javalin app) {
        app.post("/read-file", this::readFile);
        app.get("/readers", this::listReaders);
        app.get("/readers/{id}/headers", this::headers);
        app.get("/readers/{id}/signals", this::signals);
        app.delete("/readers/{id}", this::unregister);
        app.exception(PltxOpenException.class, this::openFailed);
    }

    private void readFile(Context ctx) {
        ReadFileRequest request = ctx.bodyValidator(ReadFileRequest.class)
                .check(r -> r.mode() != null, "mode is required")
                .check(r -> r.path() != null && !r.path().isBlank(), "path is required")
                .get();

        if (MODE_ONLINE.equals(request.mode())) {
            throw new BadRequestResponse("Mode 'online' is not supported, only recorded files can be read");
        }
        if (!MODE_OFFLINE.equals(request.mode())) {
            throw new BadRequestResponse("Unknown mode '" + request.mode() + "'");
        }

        Path path;
        try {
            path = Path.of(request.path());
        } catch (InvalidPathException e) {
            throw new BadRequestResponse("Invalid path: " + e.getMessage());
        }

        LOGGER.debug("Reading file: mode={}, path={}", request.mode(), path);
        RegisteredFile file;
        try (PltxReader reader = PltxReader.open(path, readerOptions)) {
            file = catalog.register(reader);
        }

        PltxReader reader = file.reader();
        double created = reader.header().created();
        String createdAt = created > 0 && Double.isFinite(created)
                ? Instant.ofEpochMilli(Math.round(created * 1000.0)).toString()
                : null;
        ctx.json(new ReadFileResponse(
                file.id(),
                reader.displayName(),
                request.path(),
                request.path(),
                file.publicNames(),
                null,
                null,
                createdAt,
                null));
    }

    private void listReaders(Context ctx) {
        List<ReaderSummary> out = new ArrayList<>();
        for (RegisteredFile file : catalog.files()) {
            PltxReader reader = file.reader();
            out.add(new ReaderSummary(file.id(), reader.displayName(), reader.path().toString(),
                    reader.listSignals().size(), file.internalNames()));
        }
        ctx.json(out);
    }

    private void headers(Context ctx) {
        RegisteredFile file = requireFile(ctx);
        ctx.json(new HeadersResponse(file.id(), file.publicNames()));
    }

    private void signals(Context ctx) {
        RegisteredFile file = requireFile(ctx);
        List<SignalResponse> out = new ArrayList<>();
        for (Map.Entry<String, SignalMetadata> e : file.signals()) {
            SignalMetadata m = e.getValue();
            out.add(new SignalResponse(e.getKey(), m.name(), m.unit(), m.description(), m.source(),
                    m.sampleCount(), finiteOrNull(m.startTime()), finiteOrNull(m.endTime())));
        }
        ctx.json(out);
    }

    private void unregister(Context ctx) {
        String id = ctx.pathParam("id");
        if (!catalog.unregister(id)) {
            throw new NotFoundResponse("No registered file with id " + id);
        }
        ctx.status(HttpStatus.NO_CONTENT);
    }

    private void openFailed(PltxOpenException e, Context ctx) {
        int status = switch (e.reason()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND.getCode();
            case BAD_HEADER, BAD_INDEX -> UNPROCESSABLE;
            case IO_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR.getCode();
        };
        if (status == HttpStatus.INTERNAL_SERVER_ERROR.getCode()) {
            LOGGER.error("Failed to open {}", e.path(), e);
        } else {
            LOGGER.warn("Rejected {}: {}", e.path(), e.getMessage());
        }
        ctx.status(status).json(new ErrorResponse(e.getMessage(), e.reason().name()));
    }

    private RegisteredFile requireFile(Context ctx) {
        String id = ctx.pathParam("id");
        return catalog.file(id).orElseThrow(() -> new NotFoundResponse("No registered file with id " + id));
    }

    private static Double finiteOrNull(double v) {
        return Double.isNaN(v) ? null : v;
    }
}
