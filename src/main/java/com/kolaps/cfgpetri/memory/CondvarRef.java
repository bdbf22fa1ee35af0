package com.kolaps.cfgpetri.memory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Ссылка на условную переменную в таблице менеджера.
 */
public final class CondvarRef implements Handle {

    private final int index;

    public CondvarRef(int index) {
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
        return index == ((CondvarRef) o).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return "CondvarRef(" + index + ")";
    }
}
