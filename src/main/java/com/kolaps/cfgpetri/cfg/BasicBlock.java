package com.kolaps.cfgpetri.cfg;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

public final class BasicBlock {

    private final int index;
    private final ImmutableList<Statement> statements;
    private final Terminator terminator;

    public BasicBlock(int index, List<Statement> statements, Terminator terminator) {
        this.index = index;
        this.statements = ImmutableList.copyOf(statements);
        this.terminator = checkNotNull(terminator, "У блока bb%s нет терминатора", index);
    }

    public int getIndex() {
        return index;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public Terminator getTerminator() {
        return terminator;
    }

    @Override
    public String toString() {
        return "bb" + index;
    }
}
