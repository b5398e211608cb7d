/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server.http;

import ai.evacortex.pltx.server.PltxServer;
import ai.evacortex.pltx.server.TestServers;
import ai.evacortex.pltx.testkit.PltxFileBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.testtools.JavalinTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for file registration and reader inspection routes.
 */
class FileControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private PltxServer server;

    @BeforeEach
    void setUp() {
        server = new PltxServer(TestServers.config());
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void readFile_returnsDisambiguatedHeaders() {
        Path a = voltageFile("a.pltx");
        Path b = voltageFile("b.pltx");

        JavalinTest.test(server.app(), (srv, client) -> {
            var first = client.post("/read-file", Map.of("mode", "offline", "path", a.toString()));
            assertThat(first.code()).isEqualTo(200);
            JsonNode body = mapper.readTree(first.body().string());
            assertThat(texts(body.get("headers"))).containsExactly("Voltage", "Current");
            assertThat(body.get("name").asText()).isEqualTo("a.pltx");
            assertThat(body.get("path").asText()).isEqualTo(a.toString());
            assertThat(body.get("source").asText()).isEqualTo(a.toString());
            assertThat(body.get("id").asText()).isNotBlank();
            assertThat(body.get("created_at").asText()).isEqualTo("2023-11-14T22:13:20Z");
            assertThat(body.get("source_url").isNull()).isTrue();

            var second = client.post("/read-file", Map.of("mode", "offline", "path", b.toString()));
            assertThat(second.code()).isEqualTo(200);
            assertThat(texts(mapper.readTree(second.body().string()).get("headers")))
                    .containsExactly("Voltage_1", "Current_1");
        });
    }

    @Test
    void readFile_rejectsOnlineMode() {
        Path a = voltageFile("a.pltx");
        JavalinTest.test(server.app(), (srv, client) -> {
            assertThat(client.post("/read-file", Map.of("mode", "online", "path", a.toString())).code())
                    .isEqualTo(400);
            assertThat(client.post("/read-file", Map.of("mode", "offline")).code()).isEqualTo(400);
            assertThat(server.catalog().files()).isEmpty();
        });
    }

    @Test
    void readFile_mapsOpenFailures() throws Exception {
        Path garbage = Files.write(tempDir.resolve("garbage.pltx"), "definitely not a pltx file".getBytes());

        JavalinTest.test(server.app(), (srv, client) -> {
            var missing = client.post("/read-file",
                    Map.of("mode", "offline", "path", tempDir.resolve("missing.pltx").toString()));
            assertThat(missing.code()).isEqualTo(404);
            assertThat(mapper.readTree(missing.body().string()).get("reason").asText()).isEqualTo("NOT_FOUND");

            var bad = client.post("/read-file", Map.of("mode", "offline", "path", garbage.toString()));
            assertThat(bad.code()).isEqualTo(422);
            assertThat(mapper.readTree(bad.body().string()).get("reason").asText()).isEqualTo("BAD_HEADER");
        });
    }

    @Test
    void readers_listAndInspect() {
        Path a = voltageFile("a.pltx");
        voltageFile("b.pltx");
        String idA = server.open(a).id();
        String idB = server.open(tempDir.resolve("b.pltx")).id();

        JavalinTest.test(server.app(), (srv, client) -> {
            JsonNode readers = mapper.readTree(client.get("/readers").body().string());
            assertThat(readers.size()).isEqualTo(2);
            assertThat(readers.get(0).get("id").asText()).isEqualTo(idA);
            assertThat(readers.get(0).get("signals_count").asInt()).isEqualTo(2);
            assertThat(texts(readers.get(1).get("headers"))).containsExactly("Voltage", "Current");

            JsonNode headers = mapper.readTree(client.get("/readers/" + idB + "/headers").body().string());
            assertThat(texts(headers.get("headers"))).containsExactly("Voltage_1", "Current_1");

            JsonNode signals = mapper.readTree(client.get("/readers/" + idA + "/signals").body().string());
            assertThat(signals.get(0).get("name").asText()).isEqualTo("Voltage");
            assertThat(signals.get(0).get("unit").asText()).isEqualTo("V");
            assertThat(signals.get(0).get("sample_count").asLong()).isEqualTo(3);
            assertThat(signals.get(0).get("end_time").asDouble()).isEqualTo(0.2);
            assertThat(signals.get(1).get("sample_count").asLong()).isZero();
            assertThat(signals.get(1).get("start_time").isNull()).isTrue();

            assertThat(client.get("/readers/nope/headers").code()).isEqualTo(404);
            assertThat(client.get("/readers/nope/signals").code()).isEqualTo(404);
        });
    }

    @Test
    void deleteReader_keepsNamesReserved() {
        String id = server.open(voltageFile("a.pltx")).id();

        JavalinTest.test(server.app(), (srv, client) -> {
            assertThat(client.delete("/readers/" + id).code()).isEqualTo(204);
            assertThat(client.delete("/readers/" + id).code()).isEqualTo(404);
            assertThat(mapper.readTree(client.get("/readers").body().string()).size()).isZero();

            var again = client.post("/read-file",
                    Map.of("mode", "offline", "path", voltageFile("b.pltx").toString()));
            assertThat(texts(mapper.readTree(again.body().string()).get("headers")))
                    .containsExactly("Voltage_1", "Current_1");
        });
    }

    @Test
    void healthAndInfo() {
        JavalinTest.test(server.app(), (srv, client) -> {
            JsonNode health = mapper.readTree(client.get("/health").body().string());
            assertThat(health.get("status").asText()).isEqualTo("ok");

            JsonNode info = mapper.readTree(client.get("/info").body().string());
            assertThat(info.get("mode").asText()).isEqualTo("offline");
            assertThat(texts(info.get("file_formats"))).containsExactly("pltx");
            assertThat(info.get("version").asText()).isEqualTo("0.1.0");
        });
    }

    private Path voltageFile(String name) {
        return PltxFileBuilder.create()
                .created(1_700_000_000.0)
                .signal("Voltage", "V", "bus voltage", "can0")
                .signal("Current", "A", "bus current", "can0")
                .chunk("Voltage", new double[]{0.0, 0.1}, new double[]{1.0, 2.0})
                .chunk("Voltage", new double[]{0.2}, new double[]{3.0})
                .writeTo(tempDir.resolve(name));
    }

    private static List<String> texts(JsonNode array) {
        List<String> out = new ArrayList<>();
        array.forEach(n -> out.add(n.asText()));
        return out;
    }
}
