package com.kolaps.cfgpetri.export;

import com.google.common.collect.ImmutableList;
import com.kolaps.cfgpetri.Options;
import com.kolaps.cfgpetri.net.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Записывает сеть во все форматы из опции {@code export.formats}
 * в файлы {@code <export.folder>/<export.filename>.<расширение>}.
 */
public final class NetExporter {

    private static final Logger log = LoggerFactory.getLogger(NetExporter.class);

    private NetExporter() {
        throw new AssertionError("Cannot instantiate static utility class");
    }

    /**
     * @return пути записанных файлов в порядке форматов
     * @throws IOException если папки нет или запись не удалась
     */
    public static List<Path> writeOutputFiles(PetriNet net) throws IOException {
        Path folder = Paths.get(Options.INSTANCE.getStringOption("export.folder", "."));
        if (!Files.isDirectory(folder)) {
            throw new IOException("Папка для результатов не существует: " + folder.toAbsolutePath());
        }
        String filename = Options.INSTANCE.getStringOption("export.filename", "net");

        ImmutableList.Builder<Path> written = ImmutableList.builder();
        for (String name : Options.INSTANCE.getListOption("export.formats")) {
            OutputFormat format = OutputFormat.fromName(name);
            Path path = folder.resolve(filename + "." + format.getExtension());
            try (OutputStream out = Files.newOutputStream(path)) {
                format.createExporter().export(net, out);
            }
            log.info("Сеть записана в {}", path);
            written.add(path);
        }
        return written.build();
    }
}
