package com.kolaps.cfgpetri.cfg;

import java.util.Optional;

/**
 * Источник графов потока управления для транслятора.
 */
public interface ProgramSource {

    /**
     * @return входная функция программы; пустое значение, если ее нет (например, библиотека)
     */
    Optional<FunctionId> entryPoint();

    /**
     * @return {@code true}, если для функции доступно тело в виде графа
     */
    boolean hasCfg(FunctionId function);

    /**
     * @throws IllegalArgumentException если графа для функции нет
     */
    ControlFlowGraph cfgOf(FunctionId function);
}
