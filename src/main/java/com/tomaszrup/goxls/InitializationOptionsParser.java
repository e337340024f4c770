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
package com.tomaszrup.goxls;

import java.util.Locale;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.goxls.parser.ParseMode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the {@code initializationOptions} JSON object sent by the client
 * during the LSP {@code initialize} request.
 */
final class InitializationOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(InitializationOptionsParser.class);

    private static final String LOG_LEVEL_OPTION = "logLevel";
    private static final String PARSE_MODE_OPTION = "parseMode";
    private static final String SEMANTIC_BINDING_OPTION = "semanticBinding";
    private static final String DEBUG_HIGHLIGHT_OPTION = "debugHighlight";

    /**
     * Parse initialization options and apply the log level change they
     * request.
     *
     * @return parsed options, or {@link HighlightOptions#DEFAULTS} if the
     *         input is not a {@link JsonObject}
     */
    static HighlightOptions parse(Object initOptions) {
        if (!(initOptions instanceof JsonObject)) {
            return HighlightOptions.DEFAULTS;
        }
        JsonObject opts = (JsonObject) initOptions;
        String logLevel = stringOption(opts, LOG_LEVEL_OPTION);
        if (logLevel != null) {
            applyLogLevel(logLevel);
        }

        ParseMode parseMode = parseParseModeOption(opts);
        boolean semanticBinding = booleanOption(opts, SEMANTIC_BINDING_OPTION,
                HighlightOptions.DEFAULTS.isSemanticBinding());
        if (!semanticBinding) {
            logger.info("Semantic binding disabled via initializationOptions");
        }
        boolean debugHighlight = booleanOption(opts, DEBUG_HIGHLIGHT_OPTION,
                HighlightOptions.DEFAULTS.isDebugHighlight());
        if (debugHighlight) {
            logger.info("Highlight debugging enabled");
        }
        return new HighlightOptions(logLevel, parseMode, semanticBinding, debugHighlight);
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
        } catch (ClassCastException e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
        }
    }

    private static ParseMode parseParseModeOption(JsonObject opts) {
        String value = stringOption(opts, PARSE_MODE_OPTION);
        if (value == null) {
            return HighlightOptions.DEFAULTS.getParseMode();
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "full":
                return ParseMode.FULL;
            case "header":
                logger.info("Parsing file headers only; highlighting is disabled");
                return ParseMode.HEADER_ONLY;
            default:
                logger.warn("Unknown parse mode '{}', using {}", value, HighlightOptions.DEFAULTS.getParseMode());
                return HighlightOptions.DEFAULTS.getParseMode();
        }
    }

    private static String stringOption(JsonObject opts, String name) {
        JsonElement element = opts.get(name);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsString();
    }

    private static boolean booleanOption(JsonObject opts, String name, boolean defaultValue) {
        JsonElement element = opts.get(name);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            if (element != null) {
                logger.warn("Ignoring non-boolean value for {}: {}", name, element);
            }
            return defaultValue;
        }
        return element.getAsBoolean();
    }

    private InitializationOptionsParser() {
        // utility class
    }
}
