package com.kolaps.cfgpetri.model;

import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Place;

import static com.kolaps.cfgpetri.naming.SyncLabels.condvarNotWaitingPlace;
import static com.kolaps.cfgpetri.naming.SyncLabels.condvarNotifiedPlace;
import static com.kolaps.cfgpetri.naming.SyncLabels.condvarWaitingPlace;

/**
 * Условная переменная. "Ждет" и "не ждет" дополняют друг друга (ровно один токен на двоих),
 * поэтому потерю сигнала можно выразить без ингибиторных дуг. "Уведомлена" копит сигналы
 * для ожидающего потока.
 */
public class Condvar {

    private final int index;
    private final Place waiting;
    private final Place notWaiting;
    private final Place notified;

    public Condvar(int index, PetriNet net) {
        this.index = index;
        this.waiting = net.addPlace(condvarWaitingPlace(index));
        this.notWaiting = net.addPlace(condvarNotWaitingPlace(index));
        this.notified = net.addPlace(condvarNotifiedPlace(index));
        net.addToken(notWaiting, 1);
    }

    public int getIndex() {
        return index;
    }

    public Place getWaiting() {
        return waiting;
    }

    public Place getNotWaiting() {
        return notWaiting;
    }

    public Place getNotified() {
        return notified;
    }

    @Override
    public String toString() {
        return "Condvar(" + index + ")";
    }
}
