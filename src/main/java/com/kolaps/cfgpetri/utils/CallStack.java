package com.kolaps.cfgpetri.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkState;

/**
 * Явный стек вызовов. Вершина стека это последний добавленный элемент.
 *
 * @param <T> кадр вызова
 */
public class CallStack<T> {

    private final List<T> frames = new ArrayList<>();

    public void push(T frame) {
        frames.add(frame);
    }

    /**
     * @throws IllegalStateException если стек пуст
     */
    public T peek() {
        checkState(!frames.isEmpty(), "Стек вызовов пуст");
        return frames.get(frames.size() - 1);
    }

    /**
     * @throws IllegalStateException если стек пуст
     */
    public T pop() {
        checkState(!frames.isEmpty(), "Стек вызовов пуст");
        return frames.remove(frames.size() - 1);
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int size() {
        return frames.size();
    }

    /** Есть ли в стеке кадр, удовлетворяющий условию. */
    public boolean contains(Predicate<T> predicate) {
        for (T frame : frames) {
            if (predicate.test(frame)) {
                return true;
            }
        }
        return false;
    }
}
