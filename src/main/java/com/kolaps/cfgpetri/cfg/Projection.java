package com.kolaps.cfgpetri.cfg;

import java.util.Objects;

/**
 * Один шаг уточнения места хранения: поле агрегата ({@code .0}) или разыменование ({@code *}).
 */
public final class Projection {

    public enum Kind {
        FIELD,
        DEREF
    }

    private static final Projection DEREF = new Projection(Kind.DEREF, -1);

    private final Kind kind;
    private final int index;

    private Projection(Kind kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    public static Projection field(int index) {
        return new Projection(Kind.FIELD, index);
    }

    public static Projection deref() {
        return DEREF;
    }

    public Kind getKind() {
        return kind;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Projection that = (Projection) o;
        return index == that.index && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index);
    }

    @Override
    public String toString() {
        return kind == Kind.DEREF ? "*" : "." + index;
    }
}
