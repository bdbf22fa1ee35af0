package com.kolaps.cfgpetri.net;

/**
 * Общий предок мест и переходов сети Петри. Узел идентифицируется уникальной меткой.
 */
public abstract class Node {

    private final String label;

    Node(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
