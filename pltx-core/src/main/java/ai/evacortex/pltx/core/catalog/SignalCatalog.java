/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.core.catalog;

import ai.evacortex.pltx.core.exceptions.SignalNotFoundException;
import ai.evacortex.pltx.core.storage.PltxReader;
import ai.evacortex.pltx.core.storage.SignalCursor;
import ai.evacortex.pltx.core.storage.util.AutoLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * SignalCatalog maps catalog-wide signal names to signals of the registered files.
 *
 * <h3>Naming</h3>
 * <p>
 * Each signal of a newly registered file keeps its own name when that name has never
 * been handed out; otherwise it gets the first free {@code name_k}, k = 1, 2, ...
 * Every assigned name stays reserved for the lifetime of the catalog, so a name never
 * points at a different signal than the one it was first given to, even after the
 * file is unregistered.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Lookups and cursor opens share a read lock; registration, removal and close take
 * the write lock. A cursor opened under the read lock holds its own reader reference,
 * so unregistering a file never invalidates a stream that is already running.
 * </p>
 */
public final class SignalCatalog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SignalCatalog.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, SignalRoute> routes = new HashMap<>();
    private final Set<String> reserved = new HashSet<>();
    private final Map<String, RegisteredFile> files = new LinkedHashMap<>();
    private boolean closed;

    /**
     * Registers every signal of {@code reader} and takes a reference on it.
     *
     * @return the registration, including the public names assigned
     * @throws IllegalStateException if the catalog or the reader is closed
     */
    public RegisteredFile register(PltxReader reader) {
        try (AutoLock ignored = AutoLock.write(lock)) {
            ensureOpen();
            reader.retain();

            Map<String, String> names = new LinkedHashMap<>();
            for (String internal : internalNames(reader)) {
                names.put(internal, reserve(internal));
            }
            RegisteredFile file = new RegisteredFile(UUID.randomUUID().toString(), reader, names);
            for (Map.Entry<String, String> e : names.entrySet()) {
                routes.put(e.getValue(), new SignalRoute(e.getValue(), e.getKey(), file));
            }
            files.put(file.id(), file);

            log.info("Registered {} as {} with signals {}", reader.displayName(), file.id(), names.values());
            return file;
        }
    }

    /**
     * Removes the file's routes and gives back the catalog's reader reference. The
     * public names of the file stay reserved.
     *
     * @return false if no file with that id is registered
     */
    public boolean unregister(String fileId) {
        RegisteredFile file;
        try (AutoLock ignored = AutoLock.write(lock)) {
            file = files.remove(fileId);
            if (file == null) return false;
            for (String name : file.publicNames()) {
                routes.remove(name);
            }
        }
        log.info("Unregistered {} ({})", file.reader().displayName(), fileId);
        file.reader().release();
        return true;
    }

    /** @throws SignalNotFoundException if no signal is registered under {@code publicName} */
    public SignalRoute resolve(String publicName) {
        try (AutoLock ignored = AutoLock.read(lock)) {
            return lookup(publicName);
        }
    }

    public boolean contains(String publicName) {
        try (AutoLock ignored = AutoLock.read(lock)) {
            return routes.containsKey(publicName);
        }
    }

    public SignalCursor openCursor(String publicName) {
        try (AutoLock ignored = AutoLock.read(lock)) {
            SignalRoute route = lookup(publicName);
            return route.file().reader().openCursor(route.internalName());
        }
    }

    public SignalCursor openCursor(String publicName, double from, double to) {
        try (AutoLock ignored = AutoLock.read(lock)) {
            SignalRoute route = lookup(publicName);
            return route.file().reader().openCursor(route.internalName(), from, to);
        }
    }

    /** Registered files in registration order. */
    public List<RegisteredFile> files() {
        try (AutoLock ignored = AutoLock.read(lock)) {
            return new ArrayList<>(files.values());
        }
    }

    public Optional<RegisteredFile> file(String id) {
        try (AutoLock ignored = AutoLock.read(lock)) {
            return Optional.ofNullable(files.get(id));
        }
    }

    /** Unregisters every file. Reserved names are kept; the catalog rejects new files. */
    @Override
    public void close() {
        List<RegisteredFile> released;
        try (AutoLock ignored = AutoLock.write(lock)) {
            if (closed) return;
            closed = true;
            released = new ArrayList<>(files.values());
            files.clear();
            routes.clear();
        }
        for (RegisteredFile file : released) {
            file.reader().release();
        }
        log.debug("Catalog closed, released {} file(s)", released.size());
    }

    private SignalRoute lookup(String publicName) {
        SignalRoute route = routes.get(publicName);
        if (route == null) throw new SignalNotFoundException(publicName);
        return route;
    }

    private String reserve(String name) {
        if (reserved.add(name)) return name;
        for (int k = 1; ; k++) {
            String candidate = name + "_" + k;
            if (reserved.add(candidate)) return candidate;
        }
    }

    private static List<String> internalNames(PltxReader reader) {
        List<String> names = new ArrayList<>();
        reader.listSignals().forEach(s -> names.add(s.name()));
        return names;
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Catalog is closed");
    }
}
