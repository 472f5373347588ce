package com.archiver.core.plugin;

import com.archiver.api.ArchiverPlugin;
import com.archiver.core.Kernel;
import com.archiver.core.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds {@link ArchiverPlugin}s on the classpath and in {@code plugins/*.jar} and enables
 * those that are not switched off in the configuration.
 */
public class PluginLoader {
    private static final Logger logger = LoggerFactory.getLogger(PluginLoader.class);

    private final Kernel kernel;
    private final File pluginDir;

    // Map to track loaded plugins and their ClassLoaders for unloading
    private final Map<String, ArchiverPlugin> activePlugins = new ConcurrentHashMap<>();
    private final Map<String, URLClassLoader> pluginClassLoaders = new ConcurrentHashMap<>();

    public PluginLoader(Kernel kernel, File pluginDir) {
        this.kernel = kernel;
        this.pluginDir = pluginDir;
    }

    public void loadPlugins() {
        Configuration config = kernel.getConfigManager().getConfig();

        // 1. Classpath plugins
        for (ArchiverPlugin plugin : ServiceLoader.load(ArchiverPlugin.class, getClass().getClassLoader())) {
            if (activePlugins.containsKey(plugin.getName())) continue;
            loadPluginSafe(plugin, config);
        }

        // 2. External plugins
        File[] jars = pluginDir.isDirectory() ? pluginDir.listFiles((dir, name) -> name.endsWith(".jar")) : null;
        if (jars != null && jars.length > 0) {
            Arrays.sort(jars, Comparator.comparing(File::getName));
            for (File jar : jars) {
                try {
                    loadPluginFromFile(jar, config);
                } catch (IOException | RuntimeException e) {
                    logger.error("Failed to load plugin jar: {}", jar.getName(), e);
                }
            }
        }

        kernel.getConfigManager().saveConfig();
    }

    public boolean loadPluginFromFile(File jarFile, Configuration config) throws IOException {
        URL[] urls = new URL[] { jarFile.toURI().toURL() };
        URLClassLoader ucl = new URLClassLoader(urls, this.getClass().getClassLoader());

        boolean anyLoaded = false;
        for (ArchiverPlugin plugin : ServiceLoader.load(ArchiverPlugin.class, ucl)) {
            if (activePlugins.containsKey(plugin.getName())) {
                logger.warn("Plugin {} is already loaded. Skipping duplicate.", plugin.getName());
                continue;
            }
            if (loadPluginSafe(plugin, config)) {
                pluginClassLoaders.put(plugin.getName(), ucl);
                anyLoaded = true;
            }
        }

        if (!anyLoaded) ucl.close();
        return anyLoaded;
    }

    public void unloadPlugin(String name) {
        ArchiverPlugin plugin = activePlugins.remove(name);
        if (plugin == null) {
            logger.warn("Cannot unload unknown plugin: {}", name);
            return;
        }

        try {
            logger.info("🔌 Disabling plugin: {}", name);
            plugin.onDisable();
        } catch (RuntimeException e) {
            logger.error("Error during onDisable for {}", name, e);
        }

        URLClassLoader ucl = pluginClassLoaders.remove(name);
        if (ucl != null) {
            try {
                ucl.close();
            } catch (IOException e) {
                logger.warn("Failed to close ClassLoader for {}", name, e);
            }
        }
    }

    public void disableAll() {
        for (String name : new ArrayList<>(activePlugins.keySet())) {
            unloadPlugin(name);
        }
    }

    public Collection<ArchiverPlugin> getPlugins() {
        return activePlugins.values();
    }

    private boolean loadPluginSafe(ArchiverPlugin plugin, Configuration config) {
        String name = plugin.getName();

        if (!config.plugins.containsKey(name)) {
            logger.info("✨ New plugin discovered: {}", name);
            config.plugins.put(name, true);
        }

        if (!config.plugins.get(name)) {
            logger.info("Plugin {} is disabled in config.", name);
            return false;
        }

        try {
            logger.info("Loading plugin: {} v{}", name, plugin.getVersion());
            plugin.onEnable(kernel);
            activePlugins.put(name, plugin);
            return true;
        } catch (RuntimeException e) {
            logger.error("Failed to enable plugin: {}", name, e);
            return false;
        }
    }
}
