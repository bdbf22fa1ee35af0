package com.kolaps.cfgpetri.naming;

import static com.kolaps.cfgpetri.naming.NamingRegistry.sanitize;

/**
 * Метки для примитивов синхронизации. Индексы берутся из счетчиков менеджеров,
 * поэтому разные экземпляры и разные вызовы не пересекаются.
 */
public final class SyncLabels {

    private SyncLabels() {
        throw new AssertionError("Cannot instantiate static utility class");
    }

    /** Переход вызова функции примитива ({@code std_sync_Mutex_T_lock_3}). */
    public static String primitiveCallTransition(String callee, int index) {
        return sanitize(callee) + "_" + index;
    }

    public static String mutexUnlockedPlace(int index) {
        return "MUTEX_" + index + "_UNLOCKED";
    }

    public static String mutexLockedPlace(int index) {
        return "MUTEX_" + index + "_LOCKED";
    }

    public static String condvarWaitingPlace(int index) {
        return "CONDVAR_" + index + "_WAITING";
    }

    public static String condvarNotWaitingPlace(int index) {
        return "CONDVAR_" + index + "_NOT_WAITING";
    }

    public static String condvarNotifiedPlace(int index) {
        return "CONDVAR_" + index + "_NOTIFIED";
    }

    public static String waitStartTransition(String callee, int index) {
        return primitiveCallTransition(callee, index) + "_WAIT_START";
    }

    public static String waitingPlace(String callee, int index) {
        return primitiveCallTransition(callee, index) + "_WAITING_PLACE";
    }

    public static String waitEndTransition(String callee, int index) {
        return primitiveCallTransition(callee, index) + "_WAIT_END";
    }

    /** Альтернатива notify, когда никто не ждет и сигнал теряется. */
    public static String lostNotifyTransition(String callee, int index) {
        return primitiveCallTransition(callee, index) + "_LOST";
    }

    public static String threadStartPlace(int index) {
        return "THREAD_START_" + index;
    }

    public static String threadEndPlace(int index) {
        return "THREAD_END_" + index;
    }
}
