package com.archiver;

import com.archiver.api.ArchiveListener;
import com.archiver.cli.ArchiveRequest;
import com.archiver.cli.CommandParser;
import com.archiver.common.model.Attachment;
import com.archiver.common.model.Post;
import com.archiver.common.model.PostRef;
import com.archiver.core.Kernel;
import com.archiver.core.config.ConfigManager;
import com.archiver.core.config.ConfigValidator;
import com.archiver.core.config.Configuration;
import com.archiver.core.download.PostResolution;
import com.archiver.services.stats.FailureRecord;
import com.archiver.services.stats.LoggingArchiveListener;
import com.archiver.services.stats.Summary;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.util.ArrayList;
import java.util.List;

public class Main {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURES = 1;
    public static final int EXIT_USAGE = 2;

    // Created only after the streams are redirected, slf4j-simple binds System.err on first use
    private static Logger logger;

    public static void main(String[] args) {
        ArchiveRequest request;
        try {
            request = CommandParser.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(EXIT_USAGE);
            return;
        }

        setupGlobalLogging(new File(System.getProperty("archiver.logFile", "main.log")));
        System.exit(run(request, new LoggingArchiveListener()));
    }

    /**
     * Runs one archive request and returns the process exit code.
     */
    public static int run(ArchiveRequest request, ArchiveListener listener) {
        Logger log = logger();
        log.info("🚀 Starting PostArchiver for {} URL(s)", request.urls().size());

        ConfigManager configManager = new ConfigManager(new File(request.configDir() != null ? request.configDir() : "."));
        Configuration config = configManager.getConfig();
        applyOverrides(request, config);

        try {
            new ConfigValidator().validateAndReport(config);
        } catch (IllegalStateException e) {
            log.error(e.getMessage());
            return EXIT_USAGE;
        }

        Kernel kernel = new Kernel(configManager);
        kernel.start();
        try {
            List<PostRef> refs = new ArrayList<>();
            List<FailureRecord> rejected = new ArrayList<>();
            for (String url : request.urls()) {
                try {
                    refs.add(kernel.parse(url));
                } catch (IllegalArgumentException e) {
                    log.error("❌ Skipping {}: {}", url, e.getMessage());
                    rejected.add(new FailureRecord("url " + url, e.getMessage()));
                }
            }

            if (request.metadataOnly()) {
                int code = printMetadata(kernel.resolve(refs, listener));
                return rejected.isEmpty() ? code : EXIT_FAILURES;
            }

            Summary summary = kernel.archive(refs, rejected, listener);
            return summary.isClean() ? EXIT_OK : EXIT_FAILURES;
        } finally {
            kernel.shutdown();
        }
    }

    private static void applyOverrides(ArchiveRequest request, Configuration config) {
        if (request.downloadDir() != null) config.downloadPath = request.downloadDir();
        if (request.workers() != null) config.concurrency = request.workers();
        if (request.retries() != null) config.maxAttempts = request.retries();
    }

    private static int printMetadata(List<PostResolution> resolutions) {
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        int failed = 0;
        for (PostResolution resolution : resolutions) {
            if (!resolution.isResolved()) {
                failed++;
                continue;
            }
            Post post = resolution.post();
            JsonObject creator = new JsonObject();
            creator.addProperty("service", post.creator().service());
            creator.addProperty("id", post.creator().id());
            creator.addProperty("name", post.creator().name());

            JsonObject json = new JsonObject();
            json.addProperty("id", post.id());
            json.addProperty("title", post.title());
            json.add("creator", creator);
            json.addProperty("folder", post.destinationFolder().toString());
            json.add("pictures", describe(post.pictures()));
            json.add("attachments", describe(post.fileAttachments()));

            System.out.println(gson.toJson(json));
            System.out.println("--------");
        }
        return failed == 0 ? EXIT_OK : EXIT_FAILURES;
    }

    private static JsonArray describe(List<Attachment> attachments) {
        JsonArray array = new JsonArray();
        for (Attachment a : attachments) {
            JsonObject o = new JsonObject();
            o.addProperty("file", a.localFilename());
            o.addProperty("url", a.downloadUrl());
            array.add(o);
        }
        return array;
    }

    private static Logger logger() {
        if (logger == null) logger = LoggerFactory.getLogger(Main.class);
        return logger;
    }

    /**
     * Tees System.out and System.err into the log file (append mode) BEFORE any logger exists.
     */
    private static void setupGlobalLogging(File logFile) {
        try {
            File parent = logFile.getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists()) parent.mkdirs();

            FileOutputStream fileStream = new FileOutputStream(logFile, true);

            MultiOutputStream multiOut = new MultiOutputStream(System.out, fileStream);
            MultiOutputStream multiErr = new MultiOutputStream(System.err, fileStream);

            System.setOut(new PrintStream(multiOut, true, "UTF-8"));
            System.setErr(new PrintStream(multiErr, true, "UTF-8"));
        } catch (IOException e) {
            System.err.println("FATAL: Could not open log file " + logFile + ": " + e.getMessage());
        }
    }

    // Sends output to several targets (tee)
    static class MultiOutputStream extends OutputStream {
        private final OutputStream[] streams;

        public MultiOutputStream(OutputStream... streams) {
            this.streams = streams;
        }

        @Override
        public void write(int b) throws IOException {
            for (OutputStream s : streams) s.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            for (OutputStream s : streams) s.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            for (OutputStream s : streams) s.flush();
        }

        @Override
        public void close() throws IOException {
            for (OutputStream s : streams) s.close();
        }
    }
}
