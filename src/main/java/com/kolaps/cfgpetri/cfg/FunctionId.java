package com.kolaps.cfgpetri.cfg;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Идентификатор функции: полное имя, например {@code std::sync::Mutex::<T>::lock} или {@code main}.
 */
public final class FunctionId {

    private final String name;

    private FunctionId(String name) {
        this.name = name;
    }

    public static FunctionId of(String name) {
        checkArgument(name != null && !name.isEmpty(), "Имя функции не может быть пустым");
        return new FunctionId(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunctionId that = (FunctionId) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
