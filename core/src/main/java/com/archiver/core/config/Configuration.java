package com.archiver.core.config;

import com.archiver.common.util.HttpSettings;
import com.archiver.core.queue.WorkerPool;
import com.archiver.core.retry.RetryPolicy;

import java.util.HashMap;
import java.util.Map;

public class Configuration {
    // --- Main settings ---
    public String downloadPath = "downloads";

    // --- Engine ---
    public int concurrency = WorkerPool.DEFAULT_CONCURRENCY;
    public int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;

    // --- HTTP ---
    public int connectTimeoutMs = 15000;
    public int readTimeoutMs = 30000;
    public String userAgent = HttpSettings.DEFAULT_USER_AGENT;

    // Key = plugin name, value = enabled
    public Map<String, Boolean> plugins = new HashMap<>();

    // Key = plugin name, value = plugin settings (e.g. "kemono_api_root" -> "https://...")
    public Map<String, Map<String, String>> pluginConfigs = new HashMap<>();

    public String getPluginSetting(String pluginName, String key, String defaultValue) {
        if (pluginConfigs == null || !pluginConfigs.containsKey(pluginName))
            return defaultValue;
        return pluginConfigs.get(pluginName).getOrDefault(key, defaultValue);
    }

    public void setPluginSetting(String pluginName, String key, String value) {
        if (pluginConfigs == null) pluginConfigs = new HashMap<>();
        pluginConfigs.computeIfAbsent(pluginName, k -> new HashMap<>()).put(key, value);
    }

    public HttpSettings httpSettings() {
        return new HttpSettings(connectTimeoutMs, readTimeoutMs, userAgent, Map.of());
    }
}
