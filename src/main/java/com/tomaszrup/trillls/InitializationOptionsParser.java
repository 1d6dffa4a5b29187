////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.trillls;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.trillls.core.ClosePolicy;
import com.tomaszrup.trillls.core.ColumnEncoding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the {@code initializationOptions} JSON object sent by the client
 * during the LSP {@code initialize} request, and the {@code trill} section
 * of {@code workspace/didChangeConfiguration} settings.
 */
class InitializationOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(InitializationOptionsParser.class);

    static final String SETTINGS_SECTION = "trill";

    private static final String LOG_LEVEL_OPTION = "logLevel";
    private static final String CLOSE_POLICY_OPTION = "closePolicy";
    private static final String COLUMN_ENCODING_OPTION = "columnEncoding";

    /** Immutable container for parsed initialization options. */
    static final class ParsedOptions {
        final ClosePolicy closePolicy;
        final ColumnEncoding columnEncoding;

        ParsedOptions(ClosePolicy closePolicy, ColumnEncoding columnEncoding) {
            this.closePolicy = closePolicy;
            this.columnEncoding = columnEncoding;
        }
    }

    /**
     * Parse initialization options and apply the log level change.
     * Unrecognized values are logged and left unset.
     *
     * @return parsed options, or {@code null} if the input is not a
     *         {@link JsonObject}
     */
    static ParsedOptions parse(Object initOptions) {
        if (!(initOptions instanceof JsonObject)) {
            return null;
        }
        JsonObject opts = (JsonObject) initOptions;
        applyLogLevelOption(opts);
        return new ParsedOptions(parseClosePolicyOption(opts), parseColumnEncodingOption(opts));
    }

    /**
     * Applies the {@code trill} section of a configuration change. Only the
     * log level can change after initialization.
     */
    static void applySettings(Object settings) {
        if (!(settings instanceof JsonObject)) {
            return;
        }
        JsonObject root = (JsonObject) settings;
        if (!root.has(SETTINGS_SECTION) || !root.get(SETTINGS_SECTION).isJsonObject()) {
            return;
        }
        applyLogLevelOption(root.getAsJsonObject(SETTINGS_SECTION));
    }

    private static void applyLogLevelOption(JsonObject opts) {
        String value = stringOption(opts, LOG_LEVEL_OPTION);
        if (value != null) {
            applyLogLevel(value);
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.info("Log level changed from {} to {}", previous, level);
        } catch (Exception e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
        }
    }

    private static ClosePolicy parseClosePolicyOption(JsonObject opts) {
        String value = stringOption(opts, CLOSE_POLICY_OPTION);
        if (value == null) {
            return null;
        }
        try {
            ClosePolicy policy = ClosePolicy.fromString(value);
            logger.info("Close policy: {}", policy);
            return policy;
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring {} option: {}", CLOSE_POLICY_OPTION, e.getMessage());
            return null;
        }
    }

    private static ColumnEncoding parseColumnEncodingOption(JsonObject opts) {
        String value = stringOption(opts, COLUMN_ENCODING_OPTION);
        if (value == null) {
            return null;
        }
        try {
            ColumnEncoding encoding = ColumnEncoding.fromString(value);
            logger.info("Column encoding: {}", encoding);
            return encoding;
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring {} option: {}", COLUMN_ENCODING_OPTION, e.getMessage());
            return null;
        }
    }

    private static String stringOption(JsonObject opts, String name) {
        JsonElement element = opts.get(name);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsString();
    }

    private InitializationOptionsParser() {
        // utility class
    }
}
