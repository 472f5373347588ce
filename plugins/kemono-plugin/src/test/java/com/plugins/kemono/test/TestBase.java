package com.plugins.kemono.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for the plugin tests. Logs the start and end of each test.
 */
public abstract class TestBase {
    protected static final Logger logger = LoggerFactory.getLogger(TestBase.class);

    @BeforeEach
    void logStart(TestInfo testInfo) {
        logger.info("🧪 Starting test: {}", testInfo.getDisplayName());
    }

    @AfterEach
    void logFinish(TestInfo testInfo) {
        logger.info("✅ Finished test: {}", testInfo.getDisplayName());
    }
}
