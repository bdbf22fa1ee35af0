package com.kolaps.cfgpetri.sync;

import com.google.common.collect.ImmutableList;
import com.kolaps.cfgpetri.cfg.FunctionId;
import com.kolaps.cfgpetri.cfg.Location;
import com.kolaps.cfgpetri.cfg.Operand;
import com.kolaps.cfgpetri.memory.CondvarRef;
import com.kolaps.cfgpetri.memory.HandleMemory;
import com.kolaps.cfgpetri.memory.MutexRef;
import com.kolaps.cfgpetri.memory.ThreadRef;
import com.kolaps.cfgpetri.model.ThreadSpan;
import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Verify.verify;
import static com.kolaps.cfgpetri.SpecialFunctions.foreignCall;
import static com.kolaps.cfgpetri.naming.SyncLabels.primitiveCallTransition;

/**
 * Потоки программы: {@code spawn} ставит тело потока в очередь, {@code join} запоминает
 * переход, к которому позже будет подключен конец потока.
 */
public class ThreadManager {

    private static final Logger log = LoggerFactory.getLogger(ThreadManager.class);

    private final PetriNet net;
    private final List<ThreadSpan> threads = new ArrayList<>();
    private final Deque<ThreadSpan> pending = new ArrayDeque<>();
    private int joinCounter;

    public ThreadManager(PetriNet net) {
        this.net = net;
    }

    /**
     * {@code thread::spawn(f)}. Мьютексы и условные переменные, захваченные замыканием,
     * перемещаются из памяти вызывающего кадра в описание потока.
     */
    public ThreadRef translateCallSpawn(PrimitiveCall call, HandleMemory memory) {
        Operand closure = call.argument(0);
        Optional<FunctionId> threadFunction = closure.getFunction();
        verify(threadFunction.isPresent(), "BUG: %s должен получить функцию потока, а не %s",
                call.getCallee(), closure);

        int index = threads.size();
        Transition spawn = foreignCall(net, call.getPlaces(),
                primitiveCallTransition(call.getCallee().getName(), index));

        List<MutexRef> mutexes = ImmutableList.of();
        List<CondvarRef> condvars = ImmutableList.of();
        Optional<Location> closureLocation = closure.getLocation();
        if (closureLocation.isPresent()) {
            mutexes = memory.mutexes().removeByRoot(closureLocation.get());
            condvars = memory.condvars().removeByRoot(closureLocation.get());
        }

        ThreadSpan thread = new ThreadSpan(index, spawn, threadFunction.get(), mutexes, condvars);
        threads.add(thread);
        pending.addLast(thread);

        ThreadRef ref = new ThreadRef(index);
        memory.joinHandles().link(call.getDestination(), ref);
        log.debug("Запуск потока {}: {} мьютекс(ов), {} условных переменных",
                thread, mutexes.size(), condvars.size());
        return ref;
    }

    /**
     * {@code JoinHandle::join}. Дуги от конца потока добавляются при подготовке его трансляции.
     */
    public Transition translateCallJoin(PrimitiveCall call, HandleMemory memory) {
        ThreadRef ref = memory.joinHandles().resolve(call.argumentLocation(0));
        Transition join = foreignCall(net, call.getPlaces(),
                primitiveCallTransition(call.getCallee().getName(), joinCounter++));
        threads.get(ref.getIndex()).addJoinTransition(join);
        return join;
    }

    public boolean hasPendingThreads() {
        return !pending.isEmpty();
    }

    /** Следующий поток для трансляции в порядке запуска. */
    public ThreadSpan nextPendingThread() {
        verify(!pending.isEmpty(), "BUG: нет потоков, ожидающих трансляции");
        return pending.removeFirst();
    }

    public List<ThreadSpan> getThreads() {
        return threads;
    }
}
