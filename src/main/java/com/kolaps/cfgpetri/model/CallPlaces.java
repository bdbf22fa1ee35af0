package com.kolaps.cfgpetri.model;

import com.kolaps.cfgpetri.net.Place;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Места, между которыми встраивается фрагмент вызова: откуда вызов начинается,
 * куда возвращается управление и (необязательно) куда уходит раскрутка стека.
 */
public final class CallPlaces {

    private final Place start;
    private final Place end;
    private final Place cleanup;

    public CallPlaces(Place start, Place end, Place cleanup) {
        this.start = checkNotNull(start);
        this.end = checkNotNull(end);
        this.cleanup = cleanup;
    }

    public CallPlaces(Place start, Place end) {
        this(start, end, null);
    }

    public Place getStart() {
        return start;
    }

    public Place getEnd() {
        return end;
    }

    public Optional<Place> getCleanup() {
        return Optional.ofNullable(cleanup);
    }

    @Override
    public String toString() {
        return start + " -> " + end + (cleanup == null ? "" : " / " + cleanup);
    }
}
