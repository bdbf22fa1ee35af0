package com.kolaps.cfgpetri.cfg;

/**
 * Определяет категорию вызываемой функции по ее идентификатору.
 */
public interface CalleeClassifier {

    CalleeKind classify(FunctionId callee);
}
