package com.kolaps.cfgpetri.cfg;

/**
 * Категория вызываемой функции, определяющая, как транслируется ее вызов.
 */
public enum CalleeKind {
    /** Функция с доступным графом, в нее транслятор заходит. */
    ORDINARY,
    /** Тело недоступно, вызов моделируется одним переходом. */
    FOREIGN,
    /** Начало раскрутки стека после {@code panic!()}. */
    PANIC,
    MUTEX_NEW,
    MUTEX_LOCK,
    CONDVAR_NEW,
    CONDVAR_WAIT,
    CONDVAR_NOTIFY_ONE,
    CONDVAR_NOTIFY_ALL,
    THREAD_SPAWN,
    THREAD_JOIN,
    SHARED_NEW,
    SHARED_CLONE,
    SHARED_DEREF;

    public boolean isSynchronization() {
        return this != ORDINARY && this != FOREIGN && this != PANIC;
    }
}
