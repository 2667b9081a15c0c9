package com.phillippitts.ozconverter.service.health;

import com.phillippitts.ozconverter.config.properties.ToolPathsConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reports whether each external tool can be run.
 *
 * <p>A configured path with a directory part is checked directly; a bare name is searched on
 * the {@code PATH} (with the usual executable suffixes on Windows). Exposed via /actuator/health.
 */
@Component
public class ToolHealthIndicator implements HealthIndicator {

    private static final List<String> WINDOWS_SUFFIXES = List.of("", ".exe", ".bat", ".cmd");

    private final ToolPathsConfig tools;
    private final String searchPath;
    private final boolean windows;

    @Autowired
    public ToolHealthIndicator(ToolPathsConfig tools) {
        this(tools, System.getenv("PATH"),
                System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win"));
    }

    ToolHealthIndicator(ToolPathsConfig tools, String searchPath, boolean windows) {
        this.tools = tools;
        this.searchPath = searchPath == null ? "" : searchPath;
        this.windows = windows;
    }

    @Override
    public Health health() {
        boolean allFound = true;
        Health.Builder builder = new Health.Builder();
        for (Map.Entry<String, String> tool : tools.asMap().entrySet()) {
            Optional<Path> location = locate(tool.getValue());
            allFound &= location.isPresent();
            builder.withDetail(tool.getKey(), location
                    .map(p -> "executable at " + p)
                    .orElse("NOT FOUND: " + tool.getValue()));
        }
        return allFound ? builder.up().build() : builder.down().build();
    }

    Optional<Path> locate(String configured) {
        Path path;
        try {
            path = Path.of(configured);
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        if (path.getParent() != null || path.isAbsolute()) {
            return executable(path);
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            for (String suffix : windows ? WINDOWS_SUFFIXES : List.of("")) {
                Optional<Path> found;
                try {
                    found = executable(Path.of(dir, configured + suffix));
                } catch (InvalidPathException e) {
                    break;
                }
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Path> executable(Path candidate) {
        return Files.isRegularFile(candidate) && Files.isExecutable(candidate)
                ? Optional.of(candidate.toAbsolutePath())
                : Optional.empty();
    }
}
