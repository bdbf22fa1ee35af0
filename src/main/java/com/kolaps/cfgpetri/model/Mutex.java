package com.kolaps.cfgpetri.model;

import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Place;
import com.kolaps.cfgpetri.net.Transition;

import static com.kolaps.cfgpetri.naming.SyncLabels.mutexLockedPlace;
import static com.kolaps.cfgpetri.naming.SyncLabels.mutexUnlockedPlace;

/**
 * Мьютекс в сети Петри: пара мест "свободен" (изначально с токеном) и "захвачен".
 */
public class Mutex {

    private final int index;
    private final Place unlocked;
    private final Place locked;

    public Mutex(int index, PetriNet net) {
        this.index = index;
        this.unlocked = net.addPlace(mutexUnlockedPlace(index));
        this.locked = net.addPlace(mutexLockedPlace(index));
        net.addToken(unlocked, 1);
    }

    public int getIndex() {
        return index;
    }

    public Place getUnlocked() {
        return unlocked;
    }

    public Place getLocked() {
        return locked;
    }

    /** Переход захватывает мьютекс: забирает токен из "свободен" и кладет в "захвачен". */
    public void addLockArcs(Transition transition, PetriNet net) {
        net.addArc(unlocked, transition);
        net.addArc(transition, locked);
    }

    /** Переход освобождает мьютекс (drop guard-а). */
    public void addUnlockArcs(Transition transition, PetriNet net) {
        net.addArc(locked, transition);
        net.addArc(transition, unlocked);
    }

    @Override
    public String toString() {
        return "Mutex(" + index + ")";
    }
}
