package com.archiver.services.http;

import com.archiver.api.BinaryClient;
import com.archiver.common.util.HttpSettings;
import com.archiver.common.util.HttpUtils;

import java.io.IOException;
import java.io.InputStream;

public class HttpBinaryClient implements BinaryClient {
    private final HttpSettings settings;

    public HttpBinaryClient(HttpSettings settings) {
        this.settings = settings;
    }

    @Override
    public InputStream open(String url) throws IOException {
        return HttpUtils.openGet(url, settings);
    }
}
