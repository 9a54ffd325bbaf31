package io.github.eutro.til2cfg.util;

import org.apache.log4j.Logger;

public class Logging {
    private static final String LOGGER_NAME = "io.github.eutro.til2cfg";

    public static Logger getLogger() {
        return Logger.getLogger(LOGGER_NAME);
    }
}
