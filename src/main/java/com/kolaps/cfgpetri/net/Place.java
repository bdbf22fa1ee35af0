package com.kolaps.cfgpetri.net;

/**
 * Место сети Петри. Количество фишек меняется только через {@link PetriNet#addToken(Place, int)}.
 */
public final class Place extends Node {

    private int tokens;

    Place(String label) {
        super(label);
        this.tokens = 0;
    }

    public int getTokens() {
        return tokens;
    }

    public boolean isMarked() {
        return tokens > 0;
    }

    void setTokens(int tokens) {
        this.tokens = tokens;
    }
}
