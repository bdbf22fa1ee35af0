package com.kolaps.cfgpetri;

import com.kolaps.cfgpetri.cfg.BasicBlock;
import com.kolaps.cfgpetri.cfg.ControlFlowGraph;
import com.kolaps.cfgpetri.cfg.FunctionId;
import com.kolaps.cfgpetri.cfg.Location;
import com.kolaps.cfgpetri.memory.HandleMemory;
import com.kolaps.cfgpetri.model.CallPlaces;
import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Place;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.kolaps.cfgpetri.naming.FunctionLabels.blockPlace;

/**
 * Кадр вызова на стеке транслятора: функция, ее граф, граничные места
 * и собственная память дескрипторов.
 */
class ActivationRecord {

    private final FunctionId function;
    private final String label;
    private final ControlFlowGraph cfg;
    private final CallPlaces boundary;
    private final HandleMemory memory = new HandleMemory();
    private final Location returnDestination; // null для тела потока
    private final Map<Integer, Place> blockPlaces = new HashMap<>();
    private int nextBlock = ControlFlowGraph.ENTRY_BLOCK;

    ActivationRecord(FunctionId function, String label, ControlFlowGraph cfg, CallPlaces boundary,
                     Location returnDestination) {
        this.function = function;
        this.label = label;
        this.cfg = cfg;
        this.boundary = boundary;
        this.returnDestination = returnDestination;
        blockPlaces.put(ControlFlowGraph.ENTRY_BLOCK, boundary.getStart());
    }

    FunctionId getFunction() {
        return function;
    }

    String getLabel() {
        return label;
    }

    ControlFlowGraph getCfg() {
        return cfg;
    }

    HandleMemory getMemory() {
        return memory;
    }

    Place getStartPlace() {
        return boundary.getStart();
    }

    Place getEndPlace() {
        return boundary.getEnd();
    }

    Optional<Place> getCleanupPlace() {
        return boundary.getCleanup();
    }

    Optional<Location> getReturnDestination() {
        return Optional.ofNullable(returnDestination);
    }

    /**
     * Место начала блока. Входной блок начинается в стартовом месте кадра,
     * остальные получают место {@code <fn>__BASIC_BLOCK_<b>} при первом обращении.
     */
    Place getBlockPlace(int block, PetriNet net) {
        cfg.getBlock(block);
        Place place = blockPlaces.get(block);
        if (place == null) {
            place = net.addPlace(blockPlace(label, block));
            blockPlaces.put(block, place);
        }
        return place;
    }

    boolean hasMoreBlocks() {
        return nextBlock < cfg.blockCount();
    }

    /** Следующий блок в порядке номеров. */
    BasicBlock nextBlock() {
        return cfg.getBlock(nextBlock++);
    }

    @Override
    public String toString() {
        return label + "@bb" + nextBlock;
    }
}
