package com.kolaps.cfgpetri.memory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Ссылка на мьютекс в таблице менеджера.
 */
public final class MutexRef implements Handle {

    private final int index;

    public MutexRef(int index) {
        checkArgument(index >= 0, "Отрицательный номер экземпляра: %s", index);
        this.index = index;
    }

    @Override
    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return index == ((MutexRef) o).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return "MutexRef(" + index + ")";
    }
}
