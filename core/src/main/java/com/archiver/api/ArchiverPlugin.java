package com.archiver.api;

import com.archiver.core.Kernel;

/**
 * Extension loaded through {@link java.util.ServiceLoader}. Plugins register their
 * {@link PostSource}s in {@link #onEnable(Kernel)}.
 */
public interface ArchiverPlugin {
    String getName();

    String getVersion();

    void onEnable(Kernel kernel);

    void onDisable();
}
