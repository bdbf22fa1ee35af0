package com.kolaps.cfgpetri.memory;

import com.google.common.collect.ImmutableList;
import com.kolaps.cfgpetri.cfg.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Verify.verify;
import static com.google.common.base.Verify.verifyNotNull;

/**
 * Отображение мест хранения кадра на дескрипторы одного вида.
 * Порядок вставки сохраняется, от него зависит порядок поиска по корню.
 *
 * @param <H> вид дескриптора
 */
public class HandleMap<H extends Handle> {

    private static final Logger log = LoggerFactory.getLogger(HandleMap.class);

    private final HandleKind kind;
    private final Map<Location, H> entries = new LinkedHashMap<>();

    public HandleMap(HandleKind kind) {
        this.kind = kind;
    }

    public HandleKind getKind() {
        return kind;
    }

    /**
     * Связывает место с дескриптором. Повторное связывание перезаписывает старое значение.
     */
    public void link(Location location, H handle) {
        H previous = entries.put(location, verifyNotNull(handle));
        if (previous == null) {
            log.debug("Место {} связано с {} {}", location, kind.getDescription(), handle);
        } else if (previous.equals(handle)) {
            log.debug("Место {} повторно связано с тем же {} {}", location, kind.getDescription(), handle);
        } else {
            log.debug("Место {} перепривязано: {} {} -> {}", location, kind.getDescription(), previous, handle);
        }
    }

    /**
     * @throws com.google.common.base.VerifyException если место не связано с дескриптором этого вида
     */
    public H get(Location location) {
        H handle = entries.get(location);
        verify(handle != null, "BUG: место %s должно быть связано с %s", location, kind.getDescription());
        return handle;
    }

    /**
     * Как {@link #get(Location)}, но для разыменования ({@code (*_2)}) без своей записи
     * берется запись самой ссылки ({@code _2}).
     */
    public H resolve(Location location) {
        if (!entries.containsKey(location) && location.endsWithDeref() && entries.containsKey(location.parent())) {
            return entries.get(location.parent());
        }
        return get(location);
    }

    public boolean contains(Location location) {
        return entries.containsKey(location);
    }

    /**
     * Связывает {@code target} с тем же дескриптором, что и {@code source}.
     */
    public void linkAlias(Location target, Location source) {
        H handle = get(source);
        link(target, handle);
        log.debug("Тот же {}: {} = {}", kind.getDescription(), target, source);
    }

    /**
     * Все дескрипторы, места которых имеют тот же корень, что и {@code location},
     * без учета уточнений, в порядке их появления.
     */
    public List<H> findByRoot(Location location) {
        ImmutableList.Builder<H> result = ImmutableList.builder();
        for (Map.Entry<Location, H> entry : entries.entrySet()) {
            if (entry.getKey().hasSameRoot(location)) {
                log.debug("Найден {} в месте {}", kind.getDescription(), entry.getKey());
                result.add(entry.getValue());
            }
        }
        return result.build();
    }

    /**
     * То же, что {@link #findByRoot(Location)}, но найденные записи удаляются (перемещение в замыкание).
     */
    public List<H> removeByRoot(Location location) {
        ImmutableList.Builder<H> result = ImmutableList.builder();
        Iterator<Map.Entry<Location, H>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<Location, H> entry = iterator.next();
            if (entry.getKey().hasSameRoot(location)) {
                log.debug("{} перемещен из места {}", kind.getDescription(), entry.getKey());
                result.add(entry.getValue());
                iterator.remove();
            }
        }
        return result.build();
    }

    /**
     * Копирует все записи с префиксом {@code source} в {@code destination} с префиксом {@code target}.
     * {@code destination} может совпадать с этой таблицей.
     *
     * @return {@code true}, если была скопирована хотя бы одна запись
     */
    boolean copyRootedAt(Location source, HandleMap<H> destination, Location target) {
        Map<Location, H> copied = new LinkedHashMap<>();
        for (Map.Entry<Location, H> entry : entries.entrySet()) {
            entry.getKey().rebase(source, target)
                    .ifPresent(rebased -> copied.put(rebased, entry.getValue()));
        }
        copied.forEach(destination::link);
        return !copied.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return kind + entries.toString();
    }
}
