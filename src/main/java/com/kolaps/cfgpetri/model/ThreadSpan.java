package com.kolaps.cfgpetri.model;

import com.google.common.collect.ImmutableList;
import com.kolaps.cfgpetri.cfg.FunctionId;
import com.kolaps.cfgpetri.memory.CondvarRef;
import com.kolaps.cfgpetri.memory.MutexRef;
import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Place;
import com.kolaps.cfgpetri.net.Transition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.kolaps.cfgpetri.naming.SyncLabels.threadEndPlace;
import static com.kolaps.cfgpetri.naming.SyncLabels.threadStartPlace;

/**
 * Поток, запущенный через {@code spawn}, тело которого еще предстоит оттранслировать.
 * <p>
 * Тело транслируется после основного обхода, когда уже известны все переходы {@code join}
 * этого потока.
 */
public class ThreadSpan {

    private final int index;
    private final Transition spawnTransition;
    private final FunctionId threadFunction;
    private final ImmutableList<MutexRef> mutexes;
    private final ImmutableList<CondvarRef> condvars;
    private final List<Transition> joinTransitions = new ArrayList<>();

    public ThreadSpan(int index, Transition spawnTransition, FunctionId threadFunction,
                      List<MutexRef> mutexes, List<CondvarRef> condvars) {
        this.index = index;
        this.spawnTransition = spawnTransition;
        this.threadFunction = threadFunction;
        this.mutexes = ImmutableList.copyOf(mutexes);
        this.condvars = ImmutableList.copyOf(condvars);
    }

    public int getIndex() {
        return index;
    }

    public Transition getSpawnTransition() {
        return spawnTransition;
    }

    public FunctionId getThreadFunction() {
        return threadFunction;
    }

    /** Мьютексы, перемещенные в замыкание, в порядке их обнаружения. */
    public List<MutexRef> getMutexes() {
        return mutexes;
    }

    public List<CondvarRef> getCondvars() {
        return condvars;
    }

    public void addJoinTransition(Transition joinTransition) {
        joinTransitions.add(joinTransition);
    }

    public List<Transition> getJoinTransitions() {
        return Collections.unmodifiableList(joinTransitions);
    }

    /**
     * Создает места начала и конца потока, соединяет spawn с началом и конец со всеми join.
     * Если join не было, конец потока остается тупиковым местом (detached-поток).
     *
     * @return места, между которыми транслируется тело потока
     */
    public CallPlaces prepareForTranslation(PetriNet net) {
        Place start = net.addPlace(threadStartPlace(index));
        Place end = net.addPlace(threadEndPlace(index));
        net.addArc(spawnTransition, start);
        for (Transition join : joinTransitions) {
            net.addArc(end, join);
        }
        return new CallPlaces(start, end);
    }

    @Override
    public String toString() {
        return "ThreadSpan(" + index + ", " + threadFunction + ")";
    }
}
