/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.catalog;

import ai.evacortex.pltx.core.PltxTestFiles;
import ai.evacortex.pltx.core.exceptions.SignalNotFoundException;
import ai.evacortex.pltx.core.storage.PltxReader;
import ai.evacortex.pltx.core.storage.SignalCursor;
import ai.evacortex.pltx.testkit.PltxFileBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalCatalogTest {

    @TempDir
    Path tempDir;

    @Test
    void testCollidingNamesGetSuffixesInOpenOrder() {
        try (SignalCatalog catalog = new SignalCatalog()) {
            RegisteredFile a = register(catalog, "a.pltx");
            RegisteredFile b = register(catalog, "b.pltx");
            RegisteredFile c = register(catalog, "c.pltx");

            assertEquals(List.of("Voltage", "Current"), a.publicNames());
            assertEquals(List.of("Voltage_1", "Current_1"), b.publicNames());
            assertEquals(List.of("Voltage_2", "Current_2"), c.publicNames());
            assertEquals(List.of("Voltage", "Current"), c.internalNames());

            SignalRoute route = catalog.resolve("Voltage_1");
            assertEquals("Voltage", route.internalName());
            assertSame(b, route.file());
            assertEquals(3, catalog.files().size());
        }
    }

    @Test
    void testNativeSuffixIsNotHandedOutTwice() {
        Path suffixed = PltxFileBuilder.create()
                .signal("Voltage_1")
                .writeTo(tempDir.resolve("native.pltx"));
        try (SignalCatalog catalog = new SignalCatalog()) {
            register(catalog, "a.pltx");
            try (PltxReader reader = PltxReader.open(suffixed)) {
                assertEquals(List.of("Voltage_1"), catalog.register(reader).publicNames());
            }
            assertEquals(List.of("Voltage_2", "Current_1"), register(catalog, "b.pltx").publicNames());
        }
    }

    @Test
    void testUnknownNameIsNotFound() {
        try (SignalCatalog catalog = new SignalCatalog()) {
            register(catalog, "a.pltx");
            assertThrows(SignalNotFoundException.class, () -> catalog.resolve("voltage"));
            assertThrows(SignalNotFoundException.class, () -> catalog.openCursor("Voltage_1"));
            assertFalse(catalog.contains("Power"));
        }
    }

    @Test
    void testSuffixesAreNotReusedAfterUnregister() {
        try (SignalCatalog catalog = new SignalCatalog()) {
            register(catalog, "a.pltx");
            RegisteredFile b = register(catalog, "b.pltx");

            assertTrue(catalog.unregister(b.id()));
            assertFalse(catalog.unregister(b.id()));
            assertFalse(catalog.contains("Voltage_1"));
            assertTrue(catalog.file(b.id()).isEmpty());

            RegisteredFile again = register(catalog, "c.pltx");
            assertEquals(List.of("Voltage_2", "Current_2"), again.publicNames());
        }
    }

    @Test
    void testCatalogHoldsReaderUntilUnregistered() {
        Path file = PltxTestFiles.writeVoltageAndCurrent(tempDir, "held.pltx", PltxFileBuilder.COMPRESSION_NONE);
        try (SignalCatalog catalog = new SignalCatalog()) {
            PltxReader reader;
            RegisteredFile registered;
            try (PltxReader opened = PltxReader.open(file)) {
                reader = opened;
                registered = catalog.register(opened);
            }
            assertTrue(reader.isOpen());
            assertEquals(1, reader.refCount());

            SignalCursor cursor = catalog.openCursor("Voltage");
            catalog.unregister(registered.id());
            assertTrue(reader.isOpen(), "running cursor keeps the file open");

            assertEquals(3, PltxTestFiles.drain(cursor).size());
            assertFalse(reader.isOpen());
        }
    }

    @Test
    void testCloseReleasesEveryReader() {
        SignalCatalog catalog = new SignalCatalog();
        RegisteredFile a = register(catalog, "a.pltx");
        RegisteredFile b = register(catalog, "b.pltx");

        catalog.close();
        assertFalse(a.reader().isOpen());
        assertFalse(b.reader().isOpen());
        assertTrue(catalog.files().isEmpty());
        assertThrows(IllegalStateException.class, () -> register(catalog, "c.pltx"));
    }

    @Test
    void testWindowedCursorThroughCatalog() {
        try (SignalCatalog catalog = new SignalCatalog()) {
            register(catalog, "a.pltx");
            try (SignalCursor cursor = catalog.openCursor("Voltage", 0.05, 0.25)) {
                assertEquals(2, PltxTestFiles.drain(cursor).size());
            }
        }
    }

    private RegisteredFile register(SignalCatalog catalog, String fileName) {
        Path file = PltxTestFiles.writeVoltageAndCurrent(tempDir, fileName, PltxFileBuilder.COMPRESSION_NONE);
        try (PltxReader reader = PltxReader.open(file)) {
            return catalog.register(reader);
        }
    }
}
