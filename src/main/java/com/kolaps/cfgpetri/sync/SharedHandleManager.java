package com.kolaps.cfgpetri.sync;

import com.kolaps.cfgpetri.cfg.CalleeKind;
import com.kolaps.cfgpetri.cfg.Location;
import com.kolaps.cfgpetri.memory.HandleMemory;
import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static com.kolaps.cfgpetri.SpecialFunctions.foreignCall;
import static com.kolaps.cfgpetri.naming.SyncLabels.primitiveCallTransition;

/**
 * Обертка разделяемого владения ({@code Arc}): {@code new}, {@code clone} и {@code deref}
 * транслируются как внешние вызовы со своими счетчиками и переносят дескрипторы
 * из первого аргумента в место назначения.
 */
public class SharedHandleManager {

    private static final Logger log = LoggerFactory.getLogger(SharedHandleManager.class);

    private final PetriNet net;
    private int newCounter;
    private int cloneCounter;
    private int derefCounter;

    public SharedHandleManager(PetriNet net) {
        this.net = net;
    }

    public Transition translateCall(CalleeKind kind, PrimitiveCall call, HandleMemory memory) {
        int index;
        switch (kind) {
            case SHARED_NEW:
                index = newCounter++;
                break;
            case SHARED_CLONE:
                index = cloneCounter++;
                break;
            case SHARED_DEREF:
                index = derefCounter++;
                break;
            default:
                throw new IllegalArgumentException("Не операция разделяемой обертки: " + kind);
        }
        Transition transition = foreignCall(net, call.getPlaces(),
                primitiveCallTransition(call.getCallee().getName(), index));

        if (!call.getArgs().isEmpty()) {
            Optional<Location> source = call.getArgs().get(0).getLocation();
            if (source.isPresent() && memory.propagate(call.getDestination(), source.get())) {
                log.debug("{}: дескрипторы {} перенесены в {}", kind, source.get(), call.getDestination());
            }
        }
        return transition;
    }
}
