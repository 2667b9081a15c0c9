package com.phillippitts.ozconverter.service.staging;

import com.phillippitts.ozconverter.util.FileNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the data files a multi-file disc descriptor refers to.
 *
 * <p>Supported descriptors:
 * <ul>
 *   <li>{@code .cue}: every {@code FILE "name" TYPE} line</li>
 *   <li>{@code .gdi}: every track line {@code <n> <lba> <type> <sector size> <file> <offset>}</li>
 * </ul>
 * Paths are resolved against the descriptor's directory. Whether they exist is not checked here.
 */
@Component
public class DescriptorDependencyResolver {

    private static final Logger LOG = LogManager.getLogger(DescriptorDependencyResolver.class);

    private static final Pattern CUE_FILE = Pattern.compile("FILE\\s+\"?([^\"]+)\"?\\s+\\w+");
    private static final Pattern GDI_TRACK = Pattern.compile(
            "^\\s*(\\d+)\\s+\\S+\\s+\\S+\\s+\\S+\\s+(\"([^\"]+)\"|([^\\s\"]+))(?:\\s+.*)?$");

    public boolean isDescriptor(Path path) {
        String ext = FileNames.extension(path);
        return "cue".equals(ext) || "gdi".equals(ext);
    }

    /**
     * @return referenced files in descriptor order without duplicates; empty for other file types
     * @throws IOException if the descriptor cannot be read
     */
    public List<Path> resolve(Path descriptor) throws IOException {
        String ext = FileNames.extension(descriptor);
        if (!"cue".equals(ext) && !"gdi".equals(ext)) {
            return List.of();
        }
        Path dir = descriptor.toAbsolutePath().getParent();
        Set<Path> deps = new LinkedHashSet<>();
        // Malformed bytes are replaced rather than failing; descriptors are often Latin-1
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(descriptor), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String name = "cue".equals(ext) ? cueFileName(line.strip()) : gdiFileName(line);
                if (name != null && !name.isBlank()) {
                    deps.add(dir.resolve(name).normalize());
                }
            }
        }
        LOG.debug("Descriptor {} references {} file(s)", descriptor.getFileName(), deps.size());
        return new ArrayList<>(deps);
    }

    static String cueFileName(String line) {
        if (!line.startsWith("FILE")) {
            return null;
        }
        Matcher m = CUE_FILE.matcher(line);
        if (m.find()) {
            return m.group(1).strip();
        }
        // FILE line without a type token
        String[] parts = line.split("\\s+", 3);
        if (parts.length > 1) {
            return parts[1].replace("\"", "");
        }
        LOG.warn("Could not parse FILE line in CUE: {}", line);
        return null;
    }

    static String gdiFileName(String line) {
        Matcher m = GDI_TRACK.matcher(line);
        if (!m.matches()) {
            return null;
        }
        return m.group(3) != null ? m.group(3) : m.group(4);
    }
}
