package com.goldminer.backend.services.sms.rules;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds an immutable snapshot of rules behind an atomic reference.
 *
 * <p>Readers call {@link #current()} once per operation and work on that snapshot, so a
 * concurrent reload is either fully visible or not at all. A reload that finds the file
 * missing keeps the previous snapshot and logs a warning; a reload that finds it malformed
 * keeps the previous snapshot and logs an error.
 *
 * <p>Subclasses must call {@link #initialize(boolean)} at the end of their constructor.
 */
@Slf4j
public abstract class ReloadableRuleSet<T> implements ReloadableRules {

    private final RuleFileReader reader;
    private final String location;
    private final AtomicReference<T> active;
    private volatile long loadedVersion = RuleFileReader.UNKNOWN_VERSION;

    protected ReloadableRuleSet(RuleFileReader reader, String location, T defaults) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.location = Objects.requireNonNull(location, "location");
        this.active = new AtomicReference<>(Objects.requireNonNull(defaults, "defaults"));
    }

    /**
     * Parses the file at {@code location} into a snapshot.
     *
     * @return empty when the file does not exist
     */
    protected abstract Optional<T> load(RuleFileReader reader, String location);

    /**
     * First load. With {@code failOnInvalid} a malformed file is rethrown instead of logged.
     */
    protected final void initialize(boolean failOnInvalid) {
        if (!failOnInvalid) {
            reload();
            return;
        }
        Optional<T> loaded = load(reader, location);
        if (loaded.isEmpty()) {
            log.warn("{} rules not found at {}; using built-in defaults", name(), location);
            return;
        }
        swap(loaded.get());
    }

    public T current() {
        return active.get();
    }

    public String location() {
        return location;
    }

    @Override
    public synchronized boolean reload() {
        try {
            Optional<T> loaded = load(reader, location);
            if (loaded.isEmpty()) {
                log.warn("{} rules not found at {}; keeping previous rules", name(), location);
                return false;
            }
            swap(loaded.get());
            return true;
        } catch (RuntimeException e) {
            log.error("{} rules at {} rejected; keeping previous rules: {}", name(), location, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean reloadIfModified() {
        long version = reader.lastModified(location);
        if (version == RuleFileReader.UNKNOWN_VERSION || version == loadedVersion) {
            return false;
        }
        return reload();
    }

    private void swap(T snapshot) {
        long version = reader.lastModified(location);
        active.set(snapshot);
        loadedVersion = version;
        log.info("{} rules loaded from {}", name(), location);
    }
}
