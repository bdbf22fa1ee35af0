package com.kolaps.cfgpetri.cfg;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Граф потока управления одной функции. Блок 0 является входным.
 */
public final class ControlFlowGraph {

    public static final int ENTRY_BLOCK = 0;

    private final FunctionId function;
    private final ImmutableList<BasicBlock> blocks;
    private final ImmutableList<Capture> captures;

    private ControlFlowGraph(FunctionId function, ImmutableList<BasicBlock> blocks, ImmutableList<Capture> captures) {
        this.function = function;
        this.blocks = blocks;
        this.captures = captures;
    }

    public static Builder builder(FunctionId function) {
        return new Builder(function);
    }

    public FunctionId getFunction() {
        return function;
    }

    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public BasicBlock getBlock(int index) {
        checkArgument(index >= 0 && index < blocks.size(),
                "В функции %s нет блока bb%s", function, index);
        return blocks.get(index);
    }

    public int blockCount() {
        return blocks.size();
    }

    /** Места захваченных дескрипторов для функций, которые запускаются в отдельном потоке. */
    public List<Capture> getCaptures() {
        return captures;
    }

    @Override
    public String toString() {
        return "cfg(" + function + ", " + blocks.size() + " blocks)";
    }

    public static final class Builder {
        private final FunctionId function;
        private final List<BasicBlock> blocks = new ArrayList<>();
        private final List<Capture> captures = new ArrayList<>();

        private Builder(FunctionId function) {
            this.function = checkNotNull(function);
        }

        /** Добавляет следующий по порядку блок. */
        public Builder block(Terminator terminator, Statement... statements) {
            blocks.add(new BasicBlock(blocks.size(), Arrays.asList(statements), terminator));
            return this;
        }

        public Builder capture(Capture capture) {
            captures.add(checkNotNull(capture));
            return this;
        }

        public ControlFlowGraph build() {
            checkState(!blocks.isEmpty(), "У функции %s нет ни одного блока", function);
            return new ControlFlowGraph(function, ImmutableList.copyOf(blocks), ImmutableList.copyOf(captures));
        }
    }
}
