package com.kolaps.cfgpetri.export;

import com.kolaps.cfgpetri.net.PetriNet;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Запись сети в один из форматов для внешних инструментов. Поток не закрывается.
 */
public interface PetriNetExporter {

    void export(PetriNet net, OutputStream out) throws IOException;
}
