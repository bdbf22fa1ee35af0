package com.kolaps.cfgpetri;

import com.kolaps.cfgpetri.cfg.CalleeKind;
import com.kolaps.cfgpetri.cfg.Terminator;
import com.kolaps.cfgpetri.model.CallPlaces;
import com.kolaps.cfgpetri.net.Place;

import java.util.Optional;

/**
 * Классифицированный вызов: как его транслировать и между какими местами.
 */
final class FunctionCall {

    enum Kind {
        /** Начало раскрутки стека, переход в {@code PROGRAM_PANIC}. */
        PANIC,
        /** Нет блока возврата, переход в {@code PROGRAM_END}. */
        DIVERGING,
        FOREIGN,
        /** Рекурсивный вызов, который транслируется как внешний. */
        RECURSIVE,
        SYNCHRONIZATION,
        /** Вход в тело функции с новым кадром на стеке. */
        ORDINARY
    }

    private final Kind kind;
    private final CalleeKind calleeKind;
    private final Terminator.Call terminator;
    private final Place start;
    private final CallPlaces places;

    private FunctionCall(Kind kind, CalleeKind calleeKind, Terminator.Call terminator, Place start, CallPlaces places) {
        this.kind = kind;
        this.calleeKind = calleeKind;
        this.terminator = terminator;
        this.start = start;
        this.places = places;
    }

    static FunctionCall withoutReturn(Kind kind, CalleeKind calleeKind, Terminator.Call terminator, Place start) {
        return new FunctionCall(kind, calleeKind, terminator, start, null);
    }

    static FunctionCall returning(Kind kind, CalleeKind calleeKind, Terminator.Call terminator, CallPlaces places) {
        return new FunctionCall(kind, calleeKind, terminator, places.getStart(), places);
    }

    Kind getKind() {
        return kind;
    }

    CalleeKind getCalleeKind() {
        return calleeKind;
    }

    Terminator.Call getTerminator() {
        return terminator;
    }

    Place getStart() {
        return start;
    }

    /** Пусто для {@link Kind#PANIC} и {@link Kind#DIVERGING}. */
    Optional<CallPlaces> getPlaces() {
        return Optional.ofNullable(places);
    }

    @Override
    public String toString() {
        return kind + "(" + terminator.getCallee() + ")";
    }
}
