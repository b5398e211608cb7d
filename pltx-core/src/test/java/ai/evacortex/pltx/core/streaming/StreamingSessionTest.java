/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.streaming;

import ai.evacortex.pltx.core.PltxTestFiles;
import ai.evacortex.pltx.core.storage.PltxReader;
import ai.evacortex.pltx.core.storage.SignalCursor;
import ai.evacortex.pltx.testkit.PltxFileBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StreamingSessionTest {

    @TempDir
    Path tempDir;

    /** Records what a transport would have sent. */
    private static final class RecordingChannel implements StreamChannel {
        final List<StreamMessage> sent = new ArrayList<>();
        int failAfter = Integer.MAX_VALUE;
        int crashAfter = Integer.MAX_VALUE;
        boolean completed;
        String failure;
        boolean open = true;

        @Override
        public void send(StreamMessage message) throws IOException {
            if (sent.size() >= crashAfter) {
                throw new IllegalStateException("serializer broke");
            }
            if (sent.size() >= failAfter) {
                open = false;
                throw new IOException("peer closed");
            }
            sent.add(message);
        }

        @Override
        public void complete() {
            completed = true;
            open = false;
        }

        @Override
        public void fail(String reason) {
            failure = reason;
            open = false;
        }

        @Override
        public boolean isOpen() {
            return open;
        }
    }

    @Test
    void testVoltageStreamsThreeSamplesThenEnd() {
        try (PltxReader reader = open(PltxFileBuilder.COMPRESSION_ZLIB)) {
            RecordingChannel channel = new RecordingChannel();
            StreamOutcome outcome = new StreamingSession("Voltage", reader.openCursor("Voltage"), channel).run();

            assertEquals(StreamOutcome.COMPLETED, outcome);
            assertTrue(channel.completed);
            assertNull(channel.failure);
            assertEquals(4, channel.sent.size());
            for (int i = 0; i < 3; i++) {
                StreamMessage m = channel.sent.get(i);
                assertEquals(i, m.seq());
                assertFalse(m.endFlag());
                assertEquals("", m.desc());
                assertEquals(PltxTestFiles.VOLTAGE_TS[i], m.timestamp());
                assertEquals(PltxTestFiles.VOLTAGE_VALUES[i], m.value());
            }
            StreamMessage end = channel.sent.get(3);
            assertTrue(end.endFlag());
            assertEquals(3, end.seq());
            assertEquals(0.2, end.timestamp());
            assertEquals(3.0, end.value());
            assertEquals(1, reader.refCount());
        }
    }

    @Test
    void testEmptySignalSendsOnlyEndMessage() {
        try (PltxReader reader = open(PltxFileBuilder.COMPRESSION_NONE)) {
            RecordingChannel channel = new RecordingChannel();
            StreamOutcome outcome = new StreamingSession("Current", reader.openCursor("Current"), channel).run();

            assertEquals(StreamOutcome.COMPLETED, outcome);
            assertEquals(1, channel.sent.size());
            StreamMessage end = channel.sent.get(0);
            assertTrue(end.endFlag());
            assertEquals(0, end.seq());
            assertEquals(0.0, end.timestamp());
            assertEquals(0.0, end.value());
        }
    }

    @Test
    void testCorruptChunkFailsWithoutEndMessage() {
        Path file = PltxFileBuilder.create()
                .compression(PltxFileBuilder.COMPRESSION_LZ4)
                .signal("Voltage")
                .chunk("Voltage", new double[]{0.0}, new double[]{1.0})
                .corruptChunk("Voltage", new double[]{1.0}, new double[]{2.0})
                .writeTo(tempDir.resolve("corrupt.pltx"));
        try (PltxReader reader = PltxReader.open(file)) {
            RecordingChannel channel = new RecordingChannel();
            StreamOutcome outcome = new StreamingSession("Voltage", reader.openCursor("Voltage"), channel).run();

            assertEquals(StreamOutcome.FAILED, outcome);
            assertNotNull(channel.failure);
            assertFalse(channel.completed);
            assertEquals(1, channel.sent.size());
            assertTrue(channel.sent.stream().noneMatch(StreamMessage::endFlag));
            assertEquals(1, reader.refCount());
        }
    }

    @Test
    void testPeerGoneCancelsAndReleasesCursor() {
        try (PltxReader reader = open(PltxFileBuilder.COMPRESSION_NONE)) {
            RecordingChannel channel = new RecordingChannel();
            channel.failAfter = 1;
            SignalCursor cursor = reader.openCursor("Voltage");
            StreamOutcome outcome = new StreamingSession("Voltage", cursor, channel).run();

            assertEquals(StreamOutcome.CANCELLED, outcome);
            assertEquals(1, channel.sent.size());
            assertEquals(SignalCursor.State.CLOSED, cursor.state());
            assertEquals(1, reader.refCount());
        }
    }

    @Test
    void testUnexpectedChannelErrorFailsStream() {
        try (PltxReader reader = open(PltxFileBuilder.COMPRESSION_NONE)) {
            RecordingChannel channel = new RecordingChannel();
            channel.crashAfter = 2;
            SignalCursor cursor = reader.openCursor("Voltage");
            StreamOutcome outcome = new StreamingSession("Voltage", cursor, channel).run();

            assertEquals(StreamOutcome.FAILED, outcome);
            assertEquals(StreamingSession.INTERNAL_ERROR, channel.failure);
            assertFalse(channel.completed);
            assertEquals(2, channel.sent.size());
            assertTrue(channel.sent.stream().noneMatch(StreamMessage::endFlag));
            assertEquals(SignalCursor.State.CLOSED, cursor.state());
            assertEquals(1, reader.refCount());
        }
    }

    @Test
    void testUnexpectedCursorErrorFailsStream() {
        try (PltxReader reader = open(PltxFileBuilder.COMPRESSION_NONE)) {
            RecordingChannel channel = new RecordingChannel();
            SignalCursor cursor = reader.openCursor("Voltage");
            StreamingSession session = new StreamingSession("Voltage", cursor, channel);
            // next() on a closed cursor is a programming error, not a data failure
            cursor.close();

            assertEquals(StreamOutcome.FAILED, session.run());
            assertEquals(StreamingSession.INTERNAL_ERROR, channel.failure);
            assertTrue(channel.sent.isEmpty());
            assertEquals(1, reader.refCount());
        }
    }

    @Test
    void testCancelledSessionSendsNothing() {
        try (PltxReader reader = open(PltxFileBuilder.COMPRESSION_NONE)) {
            RecordingChannel channel = new RecordingChannel();
            StreamingSession session = new StreamingSession("Voltage", reader.openCursor("Voltage"), channel);
            session.cancel();

            assertEquals(StreamOutcome.CANCELLED, session.run());
            assertTrue(session.isCancelled());
            assertTrue(channel.sent.isEmpty());
            assertFalse(channel.completed);
        }
    }

    @Test
    void testMessageJsonUsesWireFieldNames() throws Exception {
        JsonNode json = new ObjectMapper().valueToTree(StreamMessage.end(3, 0.2, 3.0));
        assertTrue(json.get("end_flag").asBoolean());
        assertEquals(3, json.get("seq").asLong());
        assertEquals("", json.get("desc").asText());
        assertEquals(0.2, json.get("timestamp").asDouble());
        assertFalse(json.has("endFlag"));
    }

    private PltxReader open(int compression) {
        return PltxReader.open(PltxTestFiles.writeVoltageAndCurrent(tempDir, "s" + compression + ".pltx", compression));
    }
}
