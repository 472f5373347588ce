package com.archiver.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the command line into an {@link ArchiveRequest}.
 * Format: {@code [--dir path] [--workers n] [--retries n] [--config dir] [--metadata-only] URL...}
 */
public class CommandParser {

    public static final String USAGE =
            "Usage: post-archiver [options] URL...\n" +
            "Options:\n" +
            "  --dir <path>       download root (default: downloads)\n" +
            "  --workers <n>      parallel downloads (default: 5)\n" +
            "  --retries <n>      attempts per request (default: 5)\n" +
            "  --config <dir>     directory holding config.json (default: .)\n" +
            "  --metadata-only    print post and creator metadata, download nothing\n" +
            "Example:\n" +
            "  post-archiver https://kemono.su/patreon/user/123/post/456";

    /**
     * @throws IllegalArgumentException if the syntax is invalid; the message is meant for the user
     */
    public static ArchiveRequest parse(String[] args) throws IllegalArgumentException {
        List<String> urls = new ArrayList<>();
        String dir = null;
        Integer workers = null;
        Integer retries = null;
        String configDir = null;
        boolean metadataOnly = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--dir":
                    dir = requireValue(args, ++i, arg);
                    break;
                case "--workers":
                    workers = parsePositive(requireValue(args, ++i, arg), arg);
                    break;
                case "--retries":
                    retries = parsePositive(requireValue(args, ++i, arg), arg);
                    break;
                case "--config":
                    configDir = requireValue(args, ++i, arg);
                    break;
                case "--metadata-only":
                    metadataOnly = true;
                    break;
                default:
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg + "\n" + USAGE);
                    }
                    urls.add(arg);
            }
        }

        if (urls.isEmpty()) {
            throw new IllegalArgumentException("No URL given.\n" + USAGE);
        }

        return new ArchiveRequest(urls, dir, workers, retries, configDir, metadataOnly);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int parsePositive(String value, String option) {
        int n;
        try {
            n = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + value);
        }
        if (n <= 0) {
            throw new IllegalArgumentException(option + " must be positive");
        }
        return n;
    }
}
