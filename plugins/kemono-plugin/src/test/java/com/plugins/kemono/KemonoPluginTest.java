package com.plugins.kemono;

import com.archiver.api.ArchiverPlugin;
import com.archiver.api.PostSource;
import com.archiver.common.model.PostRef;
import com.archiver.core.Kernel;
import com.archiver.core.config.ConfigManager;
import com.archiver.core.config.Configuration;
import com.archiver.core.plugin.PluginLoader;
import com.plugins.kemono.internal.SiteSource;
import com.plugins.kemono.test.TestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class KemonoPluginTest extends TestBase {

    @TempDir
    Path configDir;

    private static SiteSource source(Kernel kernel, String name) {
        return (SiteSource) kernel.getSources().stream()
                .filter(s -> s.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testPluginIsDiscoveredAndRegistersBothSites() {
        Kernel kernel = new Kernel(new ConfigManager(configDir.toFile()));
        kernel.start();
        try {
            List<String> names = kernel.getSources().stream().map(PostSource::getName).toList();
            assertTrue(names.containsAll(List.of("kemono", "coomer")), "Registered: " + names);
            assertEquals(Boolean.TRUE, kernel.getConfigManager().getConfig().plugins.get(KemonoPlugin.NAME));
            assertTrue(kernel.getPluginLoader().getPlugins().stream()
                    .anyMatch(p -> p.getName().equals(KemonoPlugin.NAME)));

            assertEquals(KemonoPlugin.KEMONO_API, source(kernel, "kemono").getApiRoot());
            assertEquals(KemonoPlugin.COOMER_API, source(kernel, "coomer").getApiRoot());

            assertEquals(new PostRef("coomer", "onlyfans", "a", "b"),
                    kernel.parse("https://coomer.st/onlyfans/user/a/post/b"));
            assertEquals("kemono", kernel.parse("https://kemono.cr/patreon/user/1/post/2").source());
        } finally {
            kernel.shutdown();
        }
        assertTrue(kernel.getSources().isEmpty());
    }

    @Test
    void testApiRootCanBeOverridden() {
        ConfigManager configManager = new ConfigManager(configDir.toFile());
        configManager.getConfig().setPluginSetting(KemonoPlugin.NAME, "kemono_api_root", "http://127.0.0.1:1/api/v1/");
        Kernel kernel = new Kernel(configManager);
        kernel.start();
        try {
            assertEquals("http://127.0.0.1:1/api/v1", source(kernel, "kemono").getApiRoot());
            assertEquals(KemonoPlugin.COOMER_API, source(kernel, "coomer").getApiRoot());
        } finally {
            kernel.shutdown();
        }
    }

    @Test
    void testUnloadDeregistersSources() {
        Kernel kernel = new Kernel(new ConfigManager(configDir.toFile()));
        kernel.start();
        try {
            kernel.getPluginLoader().unloadPlugin(KemonoPlugin.NAME);

            assertTrue(kernel.getSources().isEmpty());
            assertTrue(kernel.getPluginLoader().getPlugins().isEmpty());
            assertThrows(IllegalArgumentException.class,
                    () -> kernel.parse("https://kemono.su/patreon/user/1/post/2"));
        } finally {
            kernel.shutdown();
        }
    }

    @Test
    void testPluginJarIsLoadedAndUnloaded() throws Exception {
        Path jar = configDir.resolve("kemono-extra.jar");
        try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(jar))) {
            out.putNextEntry(new JarEntry("META-INF/services/" + ArchiverPlugin.class.getName()));
            out.write(KemonoPlugin.class.getName().getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
        }
        Kernel kernel = new Kernel(new ConfigManager(configDir.toFile()));
        kernel.start();
        try {
            PluginLoader loader = kernel.getPluginLoader();
            Configuration config = kernel.getConfigManager().getConfig();

            assertFalse(loader.loadPluginFromFile(jar.toFile(), config), "Already active from the classpath");

            loader.unloadPlugin(KemonoPlugin.NAME);
            assertTrue(loader.loadPluginFromFile(jar.toFile(), config));
            assertEquals(2, kernel.getSources().size());

            loader.unloadPlugin(KemonoPlugin.NAME);
            assertTrue(kernel.getSources().isEmpty());
        } finally {
            kernel.shutdown();
        }
    }

    @Test
    void testDisabledPluginRegistersNothing() {
        ConfigManager configManager = new ConfigManager(configDir.toFile());
        configManager.getConfig().plugins.put(KemonoPlugin.NAME, false);
        Kernel kernel = new Kernel(configManager);
        kernel.start();
        try {
            assertTrue(kernel.getSources().isEmpty());
            assertThrows(IllegalArgumentException.class,
                    () -> kernel.parse("https://kemono.su/patreon/user/1/post/2"));
        } finally {
            kernel.shutdown();
        }
    }
}
