package com.plugins.kemono;

import com.archiver.api.ArchiverPlugin;
import com.archiver.common.util.HttpSettings;
import com.archiver.core.Kernel;
import com.archiver.core.config.Configuration;
import com.plugins.kemono.internal.SiteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Registers the kemono and coomer sites. API roots can be overridden in config.json under
 * {@code pluginConfigs.KemonoSource.kemono_api_root} / {@code coomer_api_root}.
 */
public class KemonoPlugin implements ArchiverPlugin {
    private static final Logger logger = LoggerFactory.getLogger(KemonoPlugin.class);

    public static final String NAME = "KemonoSource";

    static final String KEMONO_API = "https://kemono.su/api/v1";
    static final String COOMER_API = "https://coomer.su/api/v1";

    private Kernel kernel;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getVersion() {
        return "1.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        this.kernel = kernel;
        Configuration config = kernel.getConfigManager().getConfig();
        HttpSettings settings = config.httpSettings();

        String kemonoApi = config.getPluginSetting(NAME, "kemono_api_root", KEMONO_API);
        String coomerApi = config.getPluginSetting(NAME, "coomer_api_root", COOMER_API);

        kernel.registerSource(new SiteSource("kemono",
                Set.of("kemono.su", "kemono.party", "kemono.cr"), kemonoApi, "https://kemono.su/", settings));
        kernel.registerSource(new SiteSource("coomer",
                Set.of("coomer.su", "coomer.party", "coomer.st"), coomerApi, "https://coomer.su/", settings));
        logger.info("🎨 Kemono sources ready (kemono: {}, coomer: {})", kemonoApi, coomerApi);
    }

    @Override
    public void onDisable() {
        if (kernel != null) {
            kernel.unregisterSource("kemono");
            kernel.unregisterSource("coomer");
        }
    }
}
