package com.kolaps.cfgpetri.memory;

/**
 * Вид дескриптора. Дескрипторы разных видов хранятся в разных таблицах и никогда не смешиваются.
 */
public enum HandleKind {
    MUTEX("mutex"),
    LOCK_GUARD("lock guard"),
    CONDVAR("condition variable"),
    JOIN_HANDLE("join handle");

    private final String description;

    HandleKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
