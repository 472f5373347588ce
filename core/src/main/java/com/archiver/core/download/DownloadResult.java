package com.archiver.core.download;

import java.nio.file.Path;

public record DownloadResult(Path localPath, long byteSize) {}
