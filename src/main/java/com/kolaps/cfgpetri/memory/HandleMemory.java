package com.kolaps.cfgpetri.memory;

import com.kolaps.cfgpetri.cfg.Location;

/**
 * Память одного кадра вызова: какие места хранения указывают на какие примитивы.
 * <p>
 * Четыре независимые таблицы: мьютексы, guard-ы захваченных мьютексов, условные переменные
 * и дескрипторы потоков ({@code JoinHandle}). Память живет ровно столько, сколько кадр.
 */
public class HandleMemory {

    private final HandleMap<MutexRef> mutexes = new HandleMap<>(HandleKind.MUTEX);
    private final HandleMap<MutexRef> lockGuards = new HandleMap<>(HandleKind.LOCK_GUARD);
    private final HandleMap<CondvarRef> condvars = new HandleMap<>(HandleKind.CONDVAR);
    private final HandleMap<ThreadRef> joinHandles = new HandleMap<>(HandleKind.JOIN_HANDLE);

    public HandleMap<MutexRef> mutexes() {
        return mutexes;
    }

    public HandleMap<MutexRef> lockGuards() {
        return lockGuards;
    }

    public HandleMap<CondvarRef> condvars() {
        return condvars;
    }

    public HandleMap<ThreadRef> joinHandles() {
        return joinHandles;
    }

    /**
     * Переносит на {@code target} все дескрипторы, с которыми связан {@code source} или его поля.
     * Если {@code source} это разыменование ({@code (*_2)}) и с ним ничего не связано,
     * используется сама ссылка {@code _2}. Если связей нет, ничего не происходит.
     *
     * @return {@code true}, если хотя бы один дескриптор был перенесен
     */
    public boolean propagate(Location target, Location source) {
        return transfer(source, this, target);
    }

    /**
     * Как {@link #propagate(Location, Location)}, но в память другого кадра
     * (передача аргументов и возвращаемого значения).
     */
    public boolean transfer(Location source, HandleMemory destination, Location target) {
        if (copyRootedAt(source, destination, target)) {
            return true;
        }
        return source.endsWithDeref() && copyRootedAt(source.parent(), destination, target);
    }

    /**
     * Копирует дескрипторы места {@code source} (включая его поля) в память {@code destination}
     * под место {@code target}.
     *
     * @return {@code true}, если был скопирован хотя бы один дескриптор
     */
    public boolean copyRootedAt(Location source, HandleMemory destination, Location target) {
        boolean copied = mutexes.copyRootedAt(source, destination.mutexes, target);
        copied |= lockGuards.copyRootedAt(source, destination.lockGuards, target);
        copied |= condvars.copyRootedAt(source, destination.condvars, target);
        copied |= joinHandles.copyRootedAt(source, destination.joinHandles, target);
        return copied;
    }

    public boolean isEmpty() {
        return mutexes.size() + lockGuards.size() + condvars.size() + joinHandles.size() == 0;
    }

    @Override
    public String toString() {
        return "HandleMemory{" + mutexes + ", " + lockGuards + ", " + condvars + ", " + joinHandles + "}";
    }
}
