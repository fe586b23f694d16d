package com.thingtalk.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for tests: logs the start and end of each test and offers
 * helpers to narrate Given/When/Then steps.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;

    @BeforeEach
    void logTestStart(TestInfo info) {
        testName = info.getDisplayName();
        logger.debug("Starting test: {}", testName);
    }

    @AfterEach
    void logTestEnd() {
        logger.debug("Finished test: {}", testName);
    }

    /**
     * Logs a test step, e.g. {@code "Given: a class with two queries"}.
     *
     * @param step the step description
     */
    protected void logStep(String step) {
        logger.debug("  {}", step);
    }

    /**
     * Logs an intermediate value.
     *
     * @param label what the value is
     * @param data the value
     */
    protected void logData(String label, Object data) {
        logger.debug("  {}: {}", label, data);
    }

    protected String testName() {
        return testName;
    }
}
