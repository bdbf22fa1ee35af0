package com.kolaps.cfgpetri.cfg;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Программа, собранная из готовых графов. Используется в тестах и библиотечными клиентами,
 * которые строят графы самостоятельно.
 */
public final class InMemoryProgram implements ProgramSource {

    private final FunctionId entryPoint;
    private final ImmutableMap<FunctionId, ControlFlowGraph> functions;

    private InMemoryProgram(FunctionId entryPoint, ImmutableMap<FunctionId, ControlFlowGraph> functions) {
        this.entryPoint = entryPoint;
        this.functions = functions;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<FunctionId> entryPoint() {
        return Optional.ofNullable(entryPoint);
    }

    @Override
    public boolean hasCfg(FunctionId function) {
        return functions.containsKey(function);
    }

    @Override
    public ControlFlowGraph cfgOf(FunctionId function) {
        ControlFlowGraph cfg = functions.get(function);
        checkArgument(cfg != null, "Нет графа для функции %s", function);
        return cfg;
    }

    public static final class Builder {
        private FunctionId entryPoint;
        private final Map<FunctionId, ControlFlowGraph> functions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder function(ControlFlowGraph cfg) {
            ControlFlowGraph previous = functions.put(cfg.getFunction(), cfg);
            checkArgument(previous == null, "Граф функции %s добавлен дважды", cfg.getFunction());
            return this;
        }

        /** Добавляет граф и объявляет его функцию входной. */
        public Builder entry(ControlFlowGraph cfg) {
            function(cfg);
            entryPoint = cfg.getFunction();
            return this;
        }

        public Builder entryPoint(FunctionId function) {
            entryPoint = checkNotNull(function);
            return this;
        }

        public InMemoryProgram build() {
            checkArgument(entryPoint == null || functions.containsKey(entryPoint),
                    "Нет графа для входной функции %s", entryPoint);
            return new InMemoryProgram(entryPoint, ImmutableMap.copyOf(functions));
        }
    }
}
