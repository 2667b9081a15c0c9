package com.phillippitts.ozconverter.service.planning;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The static job and media menu: which routine handles each (job, media) selection and
 * which extensions it reads and writes.
 */
@Component
public class RoutineCatalog {

    public static final String COMPRESS = "Compress media";
    public static final String EXTRACT = "Extract media";
    public static final String ARCHIVES = "Archives";
    public static final String INFO = "Get info from media";
    public static final String VERIFY = "Verify media";

    private static final List<String> ARCHIVE_INPUTS = List.of("7z", "zip", "rar");

    private final List<RoutineDefinition> definitions = List.of(
            def(COMPRESS, "CD image", inputs("iso", "img", "cue", "toc", "gdi"), List.of("chd"), none(), "chdman-createcd"),
            def(COMPRESS, "DVD image", inputs("iso", "gz"), List.of("chd"), none(), "chdman-createdvd"),
            def(COMPRESS, "GameCube/Wii", inputs("iso", "gcz", "wia", "rvz"), List.of("rvz", "gcz", "wia"), none(),
                    "dolphin-convert"),
            def(COMPRESS, "Hard Disk image", inputs("img"), List.of("chd"), none(), "chdman-createhd"),
            def(COMPRESS, "LaserDisc image", inputs("raw"), List.of("chd"), none(), "chdman-createld"),
            def(COMPRESS, "Raw image", inputs("img", "raw"), List.of("chd"), none(), "chdman-createraw"),
            def(COMPRESS, "PSP ISO", inputs("iso"), List.of("cso"), none(), "maxcso-compress"),

            def(EXTRACT, "CD image", List.of("chd"), List.of("cue", "toc", "gdi", "iso"),
                    Arrays.asList("bin", "bin", "bin", null), "chdman-extractcd"),
            def(EXTRACT, "DVD image", List.of("chd"), List.of("iso"), none(), "chdman-extractdvd"),
            def(EXTRACT, "GameCube/Wii", List.of("rvz", "gcz", "wia"), List.of("iso"), none(), "dolphin-extract"),
            def(EXTRACT, "Hard Disk image", List.of("chd"), List.of("img"), none(), "chdman-extracthd"),
            def(EXTRACT, "LaserDisc image", List.of("chd"), List.of("raw"), none(), "chdman-extractld"),
            def(EXTRACT, "Raw image", List.of("chd"), List.of("img", "raw"), none(), "chdman-extractraw"),

            def(ARCHIVES, "Extract to folder", List.of("7z", "zip", "rar", "gz"), List.of(), none(), "archive-extract"),
            def(ARCHIVES, "Repack to 7z", List.of("7z", "zip", "rar", "gz"), List.of("7z"), none(), "archive-repack-7z"),

            def(INFO, "CHD info", List.of("chd"), List.of(), none(), "chdman-info"),
            def(VERIFY, "Verify CHD", List.of("chd"), List.of(), none(), "chdman-verify"));

    private static RoutineDefinition def(String job, String media, List<String> in, List<String> out,
                                         List<String> secondary, String routineId) {
        return new RoutineDefinition(job, media, in, out, secondary, routineId);
    }

    private static List<String> inputs(String... media) {
        List<String> all = new ArrayList<>(Arrays.asList(media));
        for (String archive : ARCHIVE_INPUTS) {
            if (!all.contains(archive)) {
                all.add(archive);
            }
        }
        return all;
    }

    private static List<String> none() {
        return List.of();
    }

    public List<RoutineDefinition> definitions() {
        return definitions;
    }

    public Set<String> jobNames() {
        Set<String> names = new LinkedHashSet<>();
        definitions.forEach(d -> names.add(d.jobName()));
        return names;
    }

    public List<String> mediaNames(String jobName) {
        return definitions.stream()
                .filter(d -> d.jobName().equalsIgnoreCase(jobName))
                .map(RoutineDefinition::mediaName)
                .toList();
    }

    /**
     * Names compare case-insensitively.
     */
    public Optional<RoutineDefinition> find(String jobName, String mediaName) {
        return definitions.stream()
                .filter(d -> d.jobName().equalsIgnoreCase(jobName) && d.mediaName().equalsIgnoreCase(mediaName))
                .findFirst();
    }
}
