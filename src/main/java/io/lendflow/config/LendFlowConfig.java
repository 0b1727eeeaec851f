package io.lendflow.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Directory layout of one LendFlow data root.
 */
public final class LendFlowConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String PATTERNS_FILE = "patterns.json";
    public static final String SETTINGS_FILE = "lendflow-settings.json";

    private final Path rootDir;

    public LendFlowConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static LendFlowConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new LendFlowConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("lendflow.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path patternsFile() {
        return rootDir.resolve(PATTERNS_FILE);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}
