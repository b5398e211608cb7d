/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server.registry;

import ai.evacortex.pltx.server.ServerConfig.CoreLink;
import ai.evacortex.pltx.server.http.dto.ServiceInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Announces this server to a core service and keeps it informed that the server is
 * alive.
 *
 * <p>
 * {@link #register(String, int)} posts the service descriptor and the bound address
 * to {@code /register} once; a refusal or an unreachable core is fatal to startup.
 * {@link #startHeartbeat()} then posts {@code {id, timestamp}} to {@code /heartbeat}
 * at the configured interval. A failed heartbeat is logged and retried on the next
 * tick.
 * </p>
 */
public final class CoreRegistrar implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(CoreRegistrar.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final CoreLink link;
    private final ServiceInfo service;
    private final ObjectMapper mapper;
    private final HttpClient client;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong heartbeats = new AtomicLong();

    public CoreRegistrar(CoreLink link, ServiceInfo service, ObjectMapper mapper) {
        this.link = link;
        this.service = service;
        this.mapper = mapper;
        this.client = HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pltx-heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @throws CoreRegistrationException if the core is unreachable or answers with a non-2xx status
     */
    public void register(String host, int port) {
        String url = link.baseUrl() + "/register";
        LOGGER.info("Registering {} at {}", service.id(), url);
        int status;
        try {
            status = post(url, Registration.of(service, host, port, link.host(), link.port()));
        } catch (IOException e) {
            throw new CoreRegistrationException("Registration at " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CoreRegistrationException("Registration at " + url + " interrupted", e);
        }
        if (status / 100 != 2) {
            throw new CoreRegistrationException("Core refused registration at " + url + ": HTTP " + status);
        }
        LOGGER.info("Registered {} with core {}", service.id(), link.baseUrl());
    }

    public void startHeartbeat() {
        long millis = link.heartbeatInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::sendHeartbeat, 0, millis, TimeUnit.MILLISECONDS);
        LOGGER.debug("Heartbeat to {} every {} ms", link.baseUrl(), millis);
    }

    /** Heartbeats the core has acknowledged so far. */
    public long heartbeatsSent() {
        return heartbeats.get();
    }

    private void sendHeartbeat() {
        String url = link.baseUrl() + "/heartbeat";
        try {
            int status = post(url, new Heartbeat(service.id(), System.currentTimeMillis() / 1000.0));
            if (status / 100 == 2) {
                heartbeats.incrementAndGet();
                LOGGER.debug("Heartbeat sent");
            } else {
                LOGGER.warn("Heartbeat rejected by core: HTTP {}", status);
            }
        } catch (IOException e) {
            LOGGER.warn("Heartbeat to {} failed: {}", url, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the schedule
            LOGGER.error("Heartbeat to {} failed", url, e);
        }
    }

    private int post(String url, Object body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .POST(HttpRequest.BodyPublishers.ofString(json(body)))
                .header("Content-Type", "application/json")
                .timeout(REQUEST_TIMEOUT)
                .build();
        return client.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
    }

    private String json(Object body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + body.getClass().getSimpleName(), e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) scheduler.shutdownNow();
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
