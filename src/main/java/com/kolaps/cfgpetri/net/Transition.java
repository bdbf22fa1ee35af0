package com.kolaps.cfgpetri.net;

/**
 * Переход сети Петри (атомарное действие программы).
 */
public final class Transition extends Node {

    Transition(String label) {
        super(label);
    }
}
