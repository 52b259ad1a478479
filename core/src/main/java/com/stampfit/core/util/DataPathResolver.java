package com.stampfit.core.util;

import java.io.File;

public class DataPathResolver {

    public static final String DATA_DIR_PROPERTY = "stampfit.data.dir";
    public static final String DB_FILE = "patches.db";

    public static String resolveDataDirectory(StampfitConfig config) {
        // 1. System property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Config file
        if (config != null && config.data_directory != null && !config.data_directory.isEmpty()) {
            return config.data_directory;
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath(StampfitConfig config) {
        return resolveDataDirectory(config) + File.separator + DB_FILE;
    }
}
