package com.backlogstore.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads {@code config.yml} (or {@code config.yaml}) of a backlog directory.
 * Results are cached per directory and re-read when the file's modification
 * time changes. A missing or broken file yields {@link BacklogConfig#defaults()}.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final ConcurrentHashMap<Path, CachedConfig> cache = new ConcurrentHashMap<>();

    public BacklogConfig load(Path backlogDir) {
        Path key = backlogDir.toAbsolutePath().normalize();
        Path file = configFile(key);
        if (file == null) {
            cache.remove(key);
            return BacklogConfig.defaults();
        }
        FileTime modified = modifiedTime(file);
        CachedConfig cached = cache.get(key);
        if (cached != null && cached.file().equals(file) && cached.modified() != null
                && cached.modified().equals(modified)) {
            return cached.config();
        }
        BacklogConfig config = read(file);
        cache.put(key, new CachedConfig(file, modified, config));
        return config;
    }

    /** Drops the cached config of one backlog directory. */
    public void invalidate(Path backlogDir) {
        cache.remove(backlogDir.toAbsolutePath().normalize());
    }

    public void invalidateAll() {
        cache.clear();
    }

    /** The config file of a backlog directory, {@code config.yml} preferred; {@code null} if neither exists. */
    public static Path configFile(Path backlogDir) {
        Path yml = backlogDir.resolve("config.yml");
        if (Files.isRegularFile(yml)) {
            return yml;
        }
        Path yaml = backlogDir.resolve("config.yaml");
        return Files.isRegularFile(yaml) ? yaml : null;
    }

    private BacklogConfig read(Path file) {
        try {
            String content = Files.readString(file);
            if (content.isBlank()) {
                return BacklogConfig.defaults();
            }
            BacklogConfig config = YAML.readValue(content, BacklogConfig.class);
            if (config == null) {
                return BacklogConfig.defaults();
            }
            log.debug("Loaded backlog config from {}: {} statuses, prefix '{}'",
                    file, config.statuses().size(), config.taskPrefix());
            return config;
        } catch (IOException e) {
            log.warn("Could not read backlog config {}, using defaults: {}", file, e.getMessage());
            return BacklogConfig.defaults();
        }
    }

    private static FileTime modifiedTime(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            log.debug("No modification time for {}, config will not be cached: {}", file, e.getMessage());
            return null;
        }
    }

    private record CachedConfig(Path file, FileTime modified, BacklogConfig config) {
    }
}
