package com.kolaps.cfgpetri.sync;

import com.kolaps.cfgpetri.memory.CondvarRef;
import com.kolaps.cfgpetri.memory.HandleMemory;
import com.kolaps.cfgpetri.memory.MutexRef;
import com.kolaps.cfgpetri.model.CallPlaces;
import com.kolaps.cfgpetri.model.Condvar;
import com.kolaps.cfgpetri.model.Mutex;
import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Place;
import com.kolaps.cfgpetri.net.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.kolaps.cfgpetri.SpecialFunctions.foreignCall;
import static com.kolaps.cfgpetri.naming.SyncLabels.lostNotifyTransition;
import static com.kolaps.cfgpetri.naming.SyncLabels.primitiveCallTransition;
import static com.kolaps.cfgpetri.naming.SyncLabels.waitEndTransition;
import static com.kolaps.cfgpetri.naming.SyncLabels.waitStartTransition;
import static com.kolaps.cfgpetri.naming.SyncLabels.waitingPlace;

/**
 * Условные переменные: {@code new}, {@code wait(guard)}, {@code notify_one} и {@code notify_all}.
 * <p>
 * Модель рассчитана на одного ожидающего на условную переменную: "ждет" и "не ждет"
 * дополняют друг друга, поэтому второй {@code wait} блокируется, пока первый не проснется.
 */
public class CondvarManager {

    private static final Logger log = LoggerFactory.getLogger(CondvarManager.class);

    private final PetriNet net;
    private final MutexManager mutexManager;
    private final List<Condvar> condvars = new ArrayList<>();
    private int waitCounter;
    private int notifyCounter;

    public CondvarManager(PetriNet net, MutexManager mutexManager) {
        this.net = net;
        this.mutexManager = mutexManager;
    }

    public CondvarRef translateCallNew(PrimitiveCall call, HandleMemory memory) {
        int index = condvars.size();
        foreignCall(net, call.getPlaces(), primitiveCallTransition(call.getCallee().getName(), index));

        Condvar condvar = new Condvar(index, net);
        condvars.add(condvar);
        CondvarRef ref = new CondvarRef(index);
        memory.condvars().link(call.getDestination(), ref);
        log.debug("Создана {} в месте {}", condvar, call.getDestination());
        return ref;
    }

    /**
     * {@code Condvar::wait(&self, guard)}.
     * <p>
     * {@code WAIT_START} отпускает мьютекс и отмечает ожидание, {@code WAIT_END} ждет уведомления,
     * снова захватывает мьютекс и возвращает новый guard того же мьютекса.
     */
    public void translateCallWait(PrimitiveCall call, HandleMemory memory) {
        CondvarRef condvarRef = memory.condvars().resolve(call.argumentLocation(0));
        MutexRef mutexRef = memory.lockGuards().get(call.argumentLocation(1));
        Condvar condvar = getCondvar(condvarRef);
        Mutex mutex = mutexManager.getMutex(mutexRef);

        String callee = call.getCallee().getName();
        int index = waitCounter++;
        CallPlaces places = call.getPlaces();

        Transition waitStart = net.addTransition(waitStartTransition(callee, index));
        Place waitingInside = net.addPlace(waitingPlace(callee, index));
        Transition waitEnd = net.addTransition(waitEndTransition(callee, index));

        net.addArc(places.getStart(), waitStart);
        net.addArc(condvar.getNotWaiting(), waitStart);
        mutex.addUnlockArcs(waitStart, net);
        net.addArc(waitStart, condvar.getWaiting());
        net.addArc(waitStart, waitingInside);

        net.addArc(waitingInside, waitEnd);
        net.addArc(condvar.getNotified(), waitEnd);
        mutex.addLockArcs(waitEnd, net);
        net.addArc(waitEnd, places.getEnd());

        memory.lockGuards().link(call.getDestination(), mutexRef);
        log.debug("wait на {} с {}", condvar, mutex);
    }

    /**
     * {@code notify_one} и {@code notify_all}: либо будит ожидающий поток, либо сигнал теряется.
     */
    public void translateCallNotify(PrimitiveCall call, HandleMemory memory) {
        CondvarRef condvarRef = memory.condvars().resolve(call.argumentLocation(0));
        Condvar condvar = getCondvar(condvarRef);

        String callee = call.getCallee().getName();
        int index = notifyCounter++;
        Transition notify = foreignCall(net, call.getPlaces(), primitiveCallTransition(callee, index));
        net.addArc(condvar.getWaiting(), notify);
        net.addArc(notify, condvar.getNotified());
        net.addArc(notify, condvar.getNotWaiting());

        Transition lost = net.addTransition(lostNotifyTransition(callee, index));
        net.addArc(call.getPlaces().getStart(), lost);
        net.addArc(condvar.getNotWaiting(), lost);
        net.addArc(lost, condvar.getNotWaiting());
        net.addArc(lost, call.getPlaces().getEnd());
    }

    public Condvar getCondvar(CondvarRef ref) {
        return condvars.get(ref.getIndex());
    }

    public List<Condvar> getCondvars() {
        return condvars;
    }
}
