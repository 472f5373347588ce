package com.archiver.core;

import com.archiver.api.ArchiveListener;
import com.archiver.api.BinaryClient;
import com.archiver.api.DownloadStorage;
import com.archiver.api.PostSource;
import com.archiver.common.model.Post;
import com.archiver.common.model.PostRef;
import com.archiver.core.config.ConfigManager;
import com.archiver.core.config.Configuration;
import com.archiver.core.download.AttachmentDownloader;
import com.archiver.core.download.DownloadOrchestrator;
import com.archiver.core.download.DownloadTask;
import com.archiver.core.download.PostFailure;
import com.archiver.core.download.PostResolution;
import com.archiver.core.metadata.MetadataResolver;
import com.archiver.core.plugin.PluginLoader;
import com.archiver.core.retry.RetryPolicy;
import com.archiver.services.http.HttpBinaryClient;
import com.archiver.services.stats.FailureRecord;
import com.archiver.services.stats.Summary;
import com.archiver.services.stats.SummaryReporter;
import com.archiver.services.storage.LocalDownloadStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires configuration, plugins and the download engine together.
 */
public class Kernel {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    private final ConfigManager configManager;
    private final PluginLoader pluginLoader;
    private final BinaryClient binaryClient;
    private final DownloadStorage storage;

    private final List<PostSource> sources = new CopyOnWriteArrayList<>();
    // One resolver (and with it one creator cache) per source, kept for the process lifetime
    private final Map<String, MetadataResolver> resolvers = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public Kernel(ConfigManager configManager) {
        this(configManager, new HttpBinaryClient(configManager.getConfig().httpSettings()), new LocalDownloadStorage());
    }

    public Kernel(ConfigManager configManager, BinaryClient binaryClient, DownloadStorage storage) {
        this.configManager = configManager;
        this.binaryClient = binaryClient;
        this.storage = storage;
        this.pluginLoader = new PluginLoader(this,
                new File(configManager.getConfigFile().getAbsoluteFile().getParentFile(), "plugins"));
    }

    public void start() {
        if (running.getAndSet(true))
            return;
        logger.info("⚛️ Kernel booting...");
        pluginLoader.loadPlugins();
        logger.info("✅ Kernel active with {} source(s).", sources.size());
    }

    public void shutdown() {
        if (!running.getAndSet(false))
            return;
        pluginLoader.disableAll();
        sources.clear();
        resolvers.clear();
    }

    // --- SOURCE API ---

    public void registerSource(PostSource source) {
        sources.add(source);
        logger.info("Source registered: {}", source.getName());
    }

    public void unregisterSource(String name) {
        sources.removeIf(s -> s.getName().equals(name));
        resolvers.remove(name);
        logger.info("Source DEREGISTERED: {}", name);
    }

    public List<PostSource> getSources() {
        return List.copyOf(sources);
    }

    /**
     * Maps a post URL onto the source that handles it.
     *
     * @throws IllegalArgumentException if no source accepts the URL or its path is not a post path
     */
    public PostRef parse(String url) {
        for (PostSource source : sources) {
            if (source.supports(url)) {
                return source.parse(url);
            }
        }
        throw new IllegalArgumentException("No source handles URL: " + url);
    }

    // --- ARCHIVE API ---

    /**
     * Resolves posts only, without downloading anything.
     */
    public List<PostResolution> resolve(List<PostRef> refs, ArchiveListener listener) {
        return newOrchestrator(listener).resolveAll(refs, this::resolverFor);
    }

    /**
     * Resolves every post, downloads all their attachments and returns the totals.
     */
    public Summary archive(List<PostRef> refs, ArchiveListener listener) {
        return archive(refs, List.of(), listener);
    }

    /**
     * Like {@link #archive(List, ArchiveListener)}, with inputs that were already refused
     * (e.g. URLs no source accepts) listed among the summary's failures.
     */
    public Summary archive(List<PostRef> refs, List<FailureRecord> rejected, ArchiveListener listener) {
        DownloadOrchestrator orchestrator = newOrchestrator(listener);

        List<Post> posts = new ArrayList<>();
        List<PostFailure> postFailures = new ArrayList<>();
        for (PostResolution resolution : orchestrator.resolveAll(refs, this::resolverFor)) {
            if (resolution.isResolved()) {
                posts.add(resolution.post());
            } else {
                postFailures.add(resolution.failure());
            }
        }

        List<DownloadTask> outcomes = orchestrator.downloadAll(posts);
        Summary summary = SummaryReporter.summarize(outcomes, postFailures, rejected);
        listener.onSummary(summary);
        return summary;
    }

    MetadataResolver resolverFor(PostRef ref) {
        return resolvers.computeIfAbsent(ref.source(), name -> {
            PostSource source = sources.stream()
                    .filter(s -> s.getName().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown source: " + name));
            Configuration config = configManager.getConfig();
            return new MetadataResolver(source.getMetadataClient(), new RetryPolicy(config.maxAttempts),
                    Path.of(config.downloadPath));
        });
    }

    private DownloadOrchestrator newOrchestrator(ArchiveListener listener) {
        Configuration config = configManager.getConfig();
        RetryPolicy retryPolicy = new RetryPolicy(config.maxAttempts);
        AttachmentDownloader downloader = new AttachmentDownloader(binaryClient, storage, retryPolicy);
        return new DownloadOrchestrator(downloader, config.concurrency, listener);
    }

    // --- Getters ---

    public ConfigManager getConfigManager() {
        return configManager;
    }

    public PluginLoader getPluginLoader() {
        return pluginLoader;
    }
}
