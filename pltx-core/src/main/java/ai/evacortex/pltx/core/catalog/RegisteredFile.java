/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.catalog;

import ai.evacortex.pltx.core.SignalMetadata;
import ai.evacortex.pltx.core.storage.PltxReader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A file registered in a {@link SignalCatalog}, with the public name each of its
 * signals was given at registration.
 */
public final class RegisteredFile {

    private final String id;
    private final PltxReader reader;
    private final Map<String, String> publicNames;

    RegisteredFile(String id, PltxReader reader, Map<String, String> publicNames) {
        this.id = id;
        this.reader = reader;
        this.publicNames = Collections.unmodifiableMap(new LinkedHashMap<>(publicNames));
    }

    public String id()              { return id; }
    public PltxReader reader()      { return reader; }

    /** Names as stored in the file, in index order. */
    public List<String> internalNames() {
        return new ArrayList<>(publicNames.keySet());
    }

    /** Catalog-wide names, in the same order as {@link #internalNames()}. */
    public List<String> publicNames() {
        return new ArrayList<>(publicNames.values());
    }

    /** Signal metadata paired with the public name it is streamed under. */
    public List<Map.Entry<String, SignalMetadata>> signals() {
        List<Map.Entry<String, SignalMetadata>> out = new ArrayList<>();
        for (SignalMetadata meta : reader.listSignals()) {
            out.add(Map.entry(publicNames.get(meta.name()), meta));
        }
        return out;
    }
}
