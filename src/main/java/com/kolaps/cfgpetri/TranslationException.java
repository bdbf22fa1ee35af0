package com.kolaps.cfgpetri;

/**
 * Трансляция не дала сети по причине, которая зависит от входной программы,
 * а не от ошибки в трансляторе.
 */
public class TranslationException extends Exception {

    public TranslationException(String message) {
        super(message);
    }
}
