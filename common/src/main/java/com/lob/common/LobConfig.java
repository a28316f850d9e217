package com.lob.common;

import com.lob.protocol.SelfMatchPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration loaded from lob.yml (or classpath default).
 * All fields have sensible defaults for a single in-process book.
 */
public final class LobConfig {

    private static final Logger log = LoggerFactory.getLogger(LobConfig.class);

    private static final String CLASSPATH_DEFAULT = "/lob.yml";

    // Book sizing
    public int orderPoolSize = 100_000;
    public int levelPoolSize = 10_000;
    public int indexInitialCapacity = 1024;

    // Matching
    public SelfMatchPolicy selfMatchPolicy = SelfMatchPolicy.ALLOW;
    public boolean verifyInvariants = true;
    // finished orders whose status and id stay remembered; 0 = all of them
    public int retiredStatusLimit = 0;

    // Worker
    public int commandQueueCapacity = 65_536;
    public int metricsIntervalSecs = 5;

    // Display
    public int depthLevels = 5;

    public static LobConfig load(String path) {
        LobConfig cfg = new LobConfig();
        boolean fromFile = path != null && Files.exists(Paths.get(path));
        String source = fromFile ? path : "classpath:" + CLASSPATH_DEFAULT;
        if (path != null && !fromFile) {
            log.warn("Config file {} not found, trying {}", path, source);
        }
        try (InputStream is = fromFile
                ? Files.newInputStream(Paths.get(path))
                : LobConfig.class.getResourceAsStream(CLASSPATH_DEFAULT)) {
            if (is == null) {
                log.warn("No config at {}, using defaults", source);
                return cfg;
            }
            Map<String, Object> map = new Yaml().load(is);
            if (map == null) return cfg;
            applyMap(cfg, map);
            log.info("Loaded config from {}: selfMatchPolicy={} verifyInvariants={}",
                    source, cfg.selfMatchPolicy, cfg.verifyInvariants);
        } catch (Exception e) {
            log.warn("Failed to load config, using defaults: {}", e.getMessage());
            return new LobConfig();
        }
        return cfg;
    }

    private static void applyMap(LobConfig cfg, Map<String, Object> map) {
        if (map.containsKey("orderPoolSize")) cfg.orderPoolSize = (int) map.get("orderPoolSize");
        if (map.containsKey("levelPoolSize")) cfg.levelPoolSize = (int) map.get("levelPoolSize");
        if (map.containsKey("indexInitialCapacity")) cfg.indexInitialCapacity = (int) map.get("indexInitialCapacity");
        if (map.containsKey("selfMatchPolicy")) cfg.selfMatchPolicy = SelfMatchPolicy.parse((String) map.get("selfMatchPolicy"));
        if (map.containsKey("verifyInvariants")) cfg.verifyInvariants = (boolean) map.get("verifyInvariants");
        if (map.containsKey("retiredStatusLimit")) cfg.retiredStatusLimit = (int) map.get("retiredStatusLimit");
        if (map.containsKey("commandQueueCapacity")) cfg.commandQueueCapacity = (int) map.get("commandQueueCapacity");
        if (map.containsKey("metricsIntervalSecs")) cfg.metricsIntervalSecs = (int) map.get("metricsIntervalSecs");
        if (map.containsKey("depthLevels")) cfg.depthLevels = (int) map.get("depthLevels");
    }
}
