package com.kolaps.cfgpetri.memory;

/**
 * Ссылка на экземпляр примитива синхронизации в таблице соответствующего менеджера.
 */
public interface Handle {

    /**
     * @return номер экземпляра в таблице менеджера
     */
    int getIndex();
}
