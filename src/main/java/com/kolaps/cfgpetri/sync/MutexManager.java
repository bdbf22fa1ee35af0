package com.kolaps.cfgpetri.sync;

import com.kolaps.cfgpetri.cfg.Location;
import com.kolaps.cfgpetri.memory.HandleMemory;
import com.kolaps.cfgpetri.memory.MutexRef;
import com.kolaps.cfgpetri.model.Mutex;
import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.kolaps.cfgpetri.SpecialFunctions.foreignCall;
import static com.kolaps.cfgpetri.naming.SyncLabels.primitiveCallTransition;

/**
 * Мьютексы программы.
 * <p>
 * Номер мьютекса совпадает с номером вызова {@code Mutex::new}, вызовы {@code lock}
 * нумеруются отдельным счетчиком. Освобождение происходит при drop guard-а.
 */
public class MutexManager {

    private static final Logger log = LoggerFactory.getLogger(MutexManager.class);

    private final PetriNet net;
    private final List<Mutex> mutexes = new ArrayList<>();
    private int lockCounter;

    public MutexManager(PetriNet net) {
        this.net = net;
    }

    /**
     * {@code Mutex::new}: новый мьютекс, место назначения связывается с ним.
     */
    public MutexRef translateCallNew(PrimitiveCall call, HandleMemory memory) {
        int index = mutexes.size();
        foreignCall(net, call.getPlaces(), primitiveCallTransition(call.getCallee().getName(), index));

        Mutex mutex = new Mutex(index, net);
        mutexes.add(mutex);
        MutexRef ref = new MutexRef(index);
        memory.mutexes().link(call.getDestination(), ref);
        log.debug("Создан {} в месте {}", mutex, call.getDestination());
        return ref;
    }

    /**
     * {@code Mutex::lock}: переход вызова захватывает мьютекс из первого аргумента,
     * место назначения становится guard-ом этого мьютекса. Переход раскрутки мьютекс не трогает.
     */
    public Transition translateCallLock(PrimitiveCall call, HandleMemory memory) {
        Location receiver = call.argumentLocation(0);
        MutexRef ref = memory.mutexes().resolve(receiver);

        Transition lock = foreignCall(net, call.getPlaces(),
                primitiveCallTransition(call.getCallee().getName(), lockCounter++));
        getMutex(ref).addLockArcs(lock, net);
        memory.lockGuards().link(call.getDestination(), ref);
        return lock;
    }

    /**
     * Drop guard-а: переход {@code drop} возвращает токен мьютекса.
     */
    public void translateUnlock(Location guard, Transition dropTransition, HandleMemory memory) {
        MutexRef ref = memory.lockGuards().get(guard);
        getMutex(ref).addUnlockArcs(dropTransition, net);
        log.debug("Drop guard-а {} освобождает {}", guard, ref);
    }

    public Mutex getMutex(MutexRef ref) {
        return mutexes.get(ref.getIndex());
    }

    public List<Mutex> getMutexes() {
        return mutexes;
    }
}
