package com.kolaps.cfgpetri;

import com.kolaps.cfgpetri.model.CallPlaces;
import com.kolaps.cfgpetri.naming.FunctionLabels;
import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Place;
import com.kolaps.cfgpetri.net.Transition;

import java.util.Optional;

/**
 * Фрагменты сети для вызовов, в тело которых транслятор не заходит.
 */
public final class SpecialFunctions {

    private SpecialFunctions() {
        throw new AssertionError("Cannot instantiate static utility class");
    }

    /**
     * Вызов как один переход {@code start -> end}. При наличии cleanup-блока добавляется
     * второй переход {@code <label>_UNWIND}: {@code start -> cleanup}.
     *
     * @return переход нормального завершения вызова
     */
    public static Transition foreignCall(PetriNet net, CallPlaces places, String label) {
        Transition call = net.addTransition(label);
        net.addArc(places.getStart(), call);
        net.addArc(call, places.getEnd());

        Optional<Place> cleanup = places.getCleanup();
        if (cleanup.isPresent()) {
            Transition unwind = net.addTransition(FunctionLabels.unwindOf(label));
            net.addArc(places.getStart(), unwind);
            net.addArc(unwind, cleanup.get());
        }
        return call;
    }

    /**
     * Вызов функции, которая не возвращает управление ({@code -> !}). У перехода нет выходных мест:
     * поток, выполнивший его, дальше в сети не участвует, а завершение программы не отмечается.
     */
    public static Transition divergingCall(PetriNet net, Place start, String label) {
        Transition call = net.addTransition(label);
        net.addArc(start, call);
        return call;
    }

    /** {@code panic!()}: переход в аварийное завершение программы. */
    public static Transition panic(PetriNet net, Place start, Place programPanic, String label) {
        Transition call = net.addTransition(label);
        net.addArc(start, call);
        net.addArc(call, programPanic);
        return call;
    }
}
