/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.storage;

import ai.evacortex.pltx.core.SignalMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable per-file map from signal name to its metadata and ordered chunk list.
 * Built once at open time by {@link IndexLoader} and never mutated afterwards, so it
 * is read without locking.
 */
public final class SignalIndex {

    /** One signal of the file together with the chunks that hold its samples, in file order. */
    public record Entry(int signalId, SignalMetadata metadata, List<ChunkDescriptor> chunks) {
        public Entry {
            chunks = List.copyOf(chunks);
        }
    }

    private final Map<String, Entry> byName;
    private final List<SignalMetadata> metadata;
    private final int chunkCount;

    SignalIndex(List<Entry> entries) {
        Map<String, Entry> map = new LinkedHashMap<>();
        List<SignalMetadata> meta = new ArrayList<>(entries.size());
        int chunks = 0;
        for (Entry e : entries) {
            map.put(e.metadata().name(), e);
            meta.add(e.metadata());
            chunks += e.chunks().size();
        }
        this.byName = Collections.unmodifiableMap(map);
        this.metadata = Collections.unmodifiableList(meta);
        this.chunkCount = chunks;
    }

    /** Signals in header order. */
    public List<SignalMetadata> signals() {
        return metadata;
    }

    public Optional<Entry> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public int signalCount() {
        return metadata.size();
    }

    public int chunkCount() {
        return chunkCount;
    }
}
