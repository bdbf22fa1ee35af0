package com.kolaps.cfgpetri;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Настройки транслятора и экспорта. Значения по умолчанию хранятся строками,
 * типизированные геттеры принимают и строку, и готовое значение.
 * <p>
 * Ключи:
 * <ul>
 *     <li>{@code app.debug} логировать каждый созданный узел сети;</li>
 *     <li>{@code translator.skip_recursive_calls} не заходить в рекурсивные вызовы;</li>
 *     <li>{@code export.folder}, {@code export.filename} куда писать результат;</li>
 *     <li>{@code export.formats} форматы через запятую: pnml, lola, dot.</li>
 * </ul>
 */
public enum Options {

    INSTANCE;

    private static final Logger log = LoggerFactory.getLogger(Options.class);
    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final Map<String, Object> options = new HashMap<>();

    Options() {
        loadDefaultOptions();
    }

    public void setOption(String key, Object value) {
        options.put(checkNotNull(key, "key"), checkNotNull(value, "value of %s", key));
        log.debug("Опция {} = {}", key, value);
    }

    /**
     * @return значение или {@code null}, если опция не задана
     */
    public Object getOption(String key) {
        return options.get(checkNotNull(key, "key"));
    }

    public String getStringOption(String key, String defaultValue) {
        Object value = getOption(key);
        return value instanceof String ? (String) value : defaultValue;
    }

    public boolean getBooleanOption(String key, boolean defaultValue) {
        Object value = getOption(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /** Значения через запятую ({@code "pnml, dot"}), пустые элементы пропускаются. */
    public List<String> getListOption(String key) {
        return ImmutableList.copyOf(LIST_SPLITTER.split(getStringOption(key, "")));
    }

    /** Возвращает все опции к значениям по умолчанию. */
    public void reset() {
        options.clear();
        loadDefaultOptions();
    }

    private void loadDefaultOptions() {
        options.put("app.debug", "false");
        options.put("translator.skip_recursive_calls", "false");
        options.put("export.folder", ".");
        options.put("export.filename", "net");
        options.put("export.formats", "pnml");
    }
}
