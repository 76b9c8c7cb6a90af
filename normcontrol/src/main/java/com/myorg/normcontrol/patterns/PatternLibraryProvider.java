package com.myorg.normcontrol.patterns;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active pattern library. An analysis takes one {@link #current()} snapshot at its
 * start and uses it throughout, so a {@link #replace} never affects a run in progress.
 */
@Slf4j
public class PatternLibraryProvider {

    private final AtomicReference<PatternLibrary> active;

    public PatternLibraryProvider(PatternLibrary initial) {
        this.active = new AtomicReference<>(Objects.requireNonNull(initial, "initial library"));
    }

    public PatternLibrary current() {
        return active.get();
    }

    public PatternLibrary replace(PatternLibrary next) {
        PatternLibrary previous = active.getAndSet(Objects.requireNonNull(next, "next library"));
        log.info("Pattern library replaced: {} -> {}", previous.version(), next.version());
        return previous;
    }
}
