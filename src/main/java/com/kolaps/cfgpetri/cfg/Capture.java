package com.kolaps.cfgpetri.cfg;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Объявленное место в первом параметре функции потока, куда замыкание перемещает
 * мьютекс или условную переменную ({@code (*_1).0}, {@code _1.2}).
 */
public final class Capture {

    public enum Type {
        MUTEX,
        CONDVAR
    }

    private final Location location;
    private final Type type;

    public Capture(Location location, Type type) {
        this.location = checkNotNull(location);
        this.type = checkNotNull(type);
    }

    public static Capture mutex(Location location) {
        return new Capture(location, Type.MUTEX);
    }

    public static Capture condvar(Location location) {
        return new Capture(location, Type.CONDVAR);
    }

    public Location getLocation() {
        return location;
    }

    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return type + "@" + location;
    }
}
