package com.kolaps.cfgpetri.sync;

import com.google.common.collect.ImmutableList;
import com.kolaps.cfgpetri.cfg.FunctionId;
import com.kolaps.cfgpetri.cfg.Location;
import com.kolaps.cfgpetri.cfg.Operand;
import com.kolaps.cfgpetri.model.CallPlaces;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Verify.verify;

/**
 * Вызов функции примитива синхронизации в том виде, в каком его получает менеджер.
 */
public final class PrimitiveCall {

    private final FunctionId callee;
    private final ImmutableList<Operand> args;
    private final Location destination;
    private final CallPlaces places;

    public PrimitiveCall(FunctionId callee, List<Operand> args, Location destination, CallPlaces places) {
        this.callee = callee;
        this.args = ImmutableList.copyOf(args);
        this.destination = destination;
        this.places = places;
    }

    public FunctionId getCallee() {
        return callee;
    }

    public List<Operand> getArgs() {
        return args;
    }

    public Location getDestination() {
        return destination;
    }

    public CallPlaces getPlaces() {
        return places;
    }

    /**
     * @throws com.google.common.base.VerifyException если аргумента нет или это константа
     */
    public Location argumentLocation(int position) {
        Operand operand = argument(position);
        Optional<Location> location = operand.getLocation();
        verify(location.isPresent(), "BUG: аргумент %s вызова %s должен быть местом хранения, а не %s",
                position, callee, operand);
        return location.get();
    }

    public Operand argument(int position) {
        verify(position < args.size(), "BUG: вызов %s должен получить как минимум %s аргумент(ов)",
                callee, position + 1);
        return args.get(position);
    }

    @Override
    public String toString() {
        return destination + " = " + callee + args;
    }
}
