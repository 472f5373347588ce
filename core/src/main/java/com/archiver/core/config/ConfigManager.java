package com.archiver.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Loads and saves {@code config.json}. A missing file is created with defaults,
 * a broken one is logged and replaced by defaults in memory.
 */
public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    public static final String FILE_NAME = "config.json";

    private final File configFile;
    private final Gson gson;
    private Configuration configuration;

    public ConfigManager(File configDir) {
        if (!configDir.exists()) configDir.mkdirs();
        this.configFile = new File(configDir, FILE_NAME);
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
    }

    public Configuration getConfig() {
        return configuration;
    }

    public File getConfigFile() {
        return configFile;
    }

    public synchronized void saveConfig() {
        try (Writer writer = Files.newBufferedWriter(configFile.toPath(), StandardCharsets.UTF_8)) {
            gson.toJson(configuration, writer);
            logger.debug("Configuration saved to {}", configFile);
        } catch (IOException e) {
            logger.error("Failed to save config", e);
        }
    }

    private void load() {
        if (!configFile.exists()) {
            configuration = new Configuration();
            logger.info("No config file found. Created default configuration at {}", configFile);
            saveConfig();
            return;
        }

        try (Reader r = new FileReader(configFile, StandardCharsets.UTF_8)) {
            configuration = gson.fromJson(r, Configuration.class);
            if (configuration == null) configuration = new Configuration();
            logger.info("Configuration loaded from {}", configFile);
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to load configuration, using defaults", e);
            configuration = new Configuration();
        }
    }
}
