package com.kolaps.cfgpetri.export;

import java.util.Locale;

/**
 * Поддерживаемые форматы вывода и расширения их файлов.
 */
public enum OutputFormat {
    PNML("pnml"),
    LOLA("lola"),
    DOT("dot");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public PetriNetExporter createExporter() {
        switch (this) {
            case PNML:
                return new PnmlExporter();
            case LOLA:
                return new LolaExporter();
            case DOT:
                return new DotExporter();
            default:
                throw new IllegalStateException("Нет экспортера для формата " + this);
        }
    }

    /**
     * @throws IllegalArgumentException для неизвестного формата
     */
    public static OutputFormat fromName(String name) {
        for (OutputFormat format : values()) {
            if (format.extension.equals(name.trim().toLowerCase(Locale.ROOT))) {
                return format;
            }
        }
        throw new IllegalArgumentException("Неизвестный формат вывода: " + name);
    }
}
