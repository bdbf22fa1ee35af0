package com.kolaps.cfgpetri.net;

/**
 * Дуга между местом и переходом (в любом направлении) с положительным весом.
 */
public final class Arc {

    private final Node source;
    private final Node target;
    private int weight;

    Arc(Node source, Node target, int weight) {
        this.source = source;
        this.target = target;
        this.weight = weight;
    }

    public Node getSource() {
        return source;
    }

    public Node getTarget() {
        return target;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * @return true, если дуга идет из места в переход
     */
    public boolean isPlaceToTransition() {
        return source instanceof Place;
    }

    void increaseWeight(int delta) {
        this.weight = Math.addExact(this.weight, delta);
    }

    @Override
    public String toString() {
        return source.getLabel() + " -> " + target.getLabel() + (weight == 1 ? "" : " [" + weight + "]");
    }
}
