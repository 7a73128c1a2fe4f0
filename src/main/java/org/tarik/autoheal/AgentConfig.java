/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tarik.autoheal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.autoheal.error.RetryPolicy;
import org.tarik.autoheal.utils.CommonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Arrays.stream;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;

public class AgentConfig {
    private static final Logger LOG = LoggerFactory.getLogger(AgentConfig.class);
    private static final Properties properties = loadConfigPropertiesFromFile();

    public record ConfigProperty<T>(T value, boolean isSecret) {
    }

    public enum ModelProvider {
        OPENROUTER,
        OPENAI,
        ANTHROPIC,
        GOOGLE
    }

    public enum BrowserType {
        CHROMIUM,
        FIREFOX,
        WEBKIT
    }

    // -----------------------------------------------------
    // Constants
    private static final String CONFIG_FILE = "config.properties";
    private static final String MODEL_PRICING_PREFIX = "model.pricing.";

    // Main Config
    private static final ConfigProperty<Integer> START_PORT = loadPropertyAsInteger("port", "PORT", "7070", false);
    private static final ConfigProperty<String> HOST = loadProperty("host", "AGENT_HOST", "0.0.0.0", s -> s, false);

    // Model Config
    private static final ConfigProperty<ModelProvider> MODEL_PROVIDER = getProperty("model.provider", "MODEL_PROVIDER",
            "openrouter", AgentConfig::getModelProvider, false);
    private static final ConfigProperty<String> DEFAULT_MODEL = loadProperty("default.model", "DEFAULT_MODEL",
            "anthropic/claude-3.5-haiku", s -> s, false);
    private static final ConfigProperty<String> FALLBACK_MODEL = loadProperty("fallback.model", "FALLBACK_MODEL",
            "openai/gpt-4o-mini", s -> s, false);
    private static final ConfigProperty<String> MODEL_API_KEY = loadProperty("model.api.key", "MODEL_API_KEY", "",
            s -> s, true);
    private static final ConfigProperty<String> MODEL_ENDPOINT = loadProperty("model.endpoint", "MODEL_ENDPOINT",
            "https://openrouter.ai/api/v1", s -> s, false);
    private static final ConfigProperty<Integer> MAX_OUTPUT_TOKENS = loadPropertyAsInteger("model.max.output.tokens",
            "MAX_OUTPUT_TOKENS", "2000", false);
    private static final ConfigProperty<Double> GENERATION_TEMPERATURE = loadPropertyAsDouble(
            "model.generation.temperature", "GENERATION_TEMPERATURE", "0.3", false);
    private static final ConfigProperty<Double> REPAIR_TEMPERATURE = loadPropertyAsDouble("model.repair.temperature",
            "REPAIR_TEMPERATURE", "0.4", false);
    private static final ConfigProperty<Integer> MODEL_MAX_RETRIES = loadPropertyAsInteger("model.max.retries",
            "MODEL_MAX_RETRIES", "2", false);
    private static final ConfigProperty<Boolean> MODEL_LOGGING_ENABLED = loadProperty("model.logging.enabled",
            "LOG_MODEL_OUTPUT", "false", Boolean::parseBoolean, false);
    private static final ConfigProperty<String> SYNTHESIS_PROMPT_VERSION = loadProperty("synthesis.prompt.version",
            "SYNTHESIS_PROMPT_VERSION", "v1.0.0", s -> s, false);

    // Browser Config
    private static final ConfigProperty<Boolean> HEADLESS = loadProperty("headless", "HEADLESS", "true",
            Boolean::parseBoolean, false);
    private static final ConfigProperty<BrowserType> BROWSER_TYPE = getProperty("browser.type", "BROWSER_TYPE",
            "chromium", AgentConfig::getBrowserType, false);
    private static final ConfigProperty<Integer> DEFAULT_TIMEOUT_MILLIS = loadPropertyAsInteger(
            "default.timeout.millis", "DEFAULT_TIMEOUT", "30000", false);

    // Repair Config
    private static final ConfigProperty<Integer> MAX_REPAIR_ATTEMPTS = loadPropertyAsInteger("max.repair.attempts",
            "MAX_REPAIR_ATTEMPTS", "3", false);
    private static final ConfigProperty<Boolean> AUTO_HEAL = loadProperty("auto.heal", "AUTO_HEAL", "true",
            Boolean::parseBoolean, false);
    private static final ConfigProperty<Integer> REPAIR_HISTORY_WINDOW = loadPropertyAsInteger(
            "repair.history.window", "REPAIR_HISTORY_WINDOW", "2", false);
    private static final ConfigProperty<Integer> REPAIR_UNKNOWN_STREAK_LIMIT = loadPropertyAsInteger(
            "repair.unknown.streak.limit", "REPAIR_UNKNOWN_STREAK_LIMIT", "2", false);
    private static final ConfigProperty<Boolean> QUICK_FIXES_ENABLED = loadProperty("repair.quick.fixes.enabled",
            "REPAIR_QUICK_FIXES_ENABLED", "true", Boolean::parseBoolean, false);

    // Budget Config
    private static final ConfigProperty<BigDecimal> MAX_COST_PER_RUN = loadPropertyAsDecimal("max.cost.per.run",
            "MAX_COST_PER_RUN", "0.50", false);
    private static final ConfigProperty<BigDecimal> DAILY_BUDGET = loadPropertyAsDecimal("daily.budget",
            "DAILY_BUDGET", "5.00", false);
    private static final ConfigProperty<String> DAILY_SPEND_FILE = loadProperty("daily.spend.file",
            "DAILY_SPEND_FILE", "artifacts/logs/daily_costs.json", s -> s, false);
    private static final ConfigProperty<ZoneId> DAILY_RESET_ZONE = loadProperty("daily.reset.zone",
            "DAILY_RESET_ZONE", "UTC", ZoneId::of, false);
    private static final ConfigProperty<String> RUN_STORE_DIR = loadProperty("run.store.dir", "RUN_STORE_DIR",
            "artifacts/runs", s -> s, false);

    // Timeout and Retry Config
    private static final ConfigProperty<Integer> RUN_DEADLINE_MILLIS = loadPropertyAsInteger("run.deadline.millis",
            "RUN_DEADLINE_MILLIS", "600000", false);
    private static final ConfigProperty<Integer> EXECUTION_GRACE_MILLIS = loadPropertyAsInteger(
            "execution.grace.millis", "EXECUTION_GRACE_MILLIS", "5000", false);
    private static final ConfigProperty<Integer> SYNTHESIS_MAX_RETRIES = loadPropertyAsInteger(
            "synthesis.retry.max.retries", "SYNTHESIS_MAX_RETRIES", "2", false);
    private static final ConfigProperty<Integer> SYNTHESIS_RETRY_INITIAL_DELAY_MILLIS = loadPropertyAsInteger(
            "synthesis.retry.initial.delay.millis", "SYNTHESIS_RETRY_INITIAL_DELAY_MILLIS", "1000", false);
    private static final ConfigProperty<Integer> SYNTHESIS_RETRY_MAX_DELAY_MILLIS = loadPropertyAsInteger(
            "synthesis.retry.max.delay.millis", "SYNTHESIS_RETRY_MAX_DELAY_MILLIS", "8000", false);
    private static final ConfigProperty<Double> SYNTHESIS_RETRY_BACKOFF_MULTIPLIER = loadPropertyAsDouble(
            "synthesis.retry.backoff.multiplier", "SYNTHESIS_RETRY_BACKOFF_MULTIPLIER", "2.0", false);
    private static final ConfigProperty<Integer> SYNTHESIS_RETRY_TIMEOUT_MILLIS = loadPropertyAsInteger(
            "synthesis.retry.timeout.millis", "SYNTHESIS_RETRY_TIMEOUT_MILLIS", "120000", false);

    // Execution Sandbox Config
    private static final ConfigProperty<String> EXECUTION_SANDBOX_URL = loadProperty("execution.sandbox.url",
            "EXECUTION_SANDBOX_URL", "http://localhost:8090/execute", s -> s, false);

    // -----------------------------------------------------
    // Main Config
    public static int getStartPort() {
        return START_PORT.value();
    }

    public static String getHost() {
        return HOST.value();
    }

    // -----------------------------------------------------
    // Model Config
    public static ModelProvider getModelProvider() {
        return MODEL_PROVIDER.value();
    }

    public static String getDefaultModel() {
        return DEFAULT_MODEL.value();
    }

    public static String getFallbackModel() {
        return FALLBACK_MODEL.value();
    }

    public static String getModelApiKey() {
        return MODEL_API_KEY.value();
    }

    public static String getModelEndpoint() {
        return MODEL_ENDPOINT.value();
    }

    public static int getMaxOutputTokens() {
        return MAX_OUTPUT_TOKENS.value();
    }

    public static double getGenerationTemperature() {
        return GENERATION_TEMPERATURE.value();
    }

    public static double getRepairTemperature() {
        return REPAIR_TEMPERATURE.value();
    }

    public static int getModelMaxRetries() {
        return MODEL_MAX_RETRIES.value();
    }

    public static boolean isModelLoggingEnabled() {
        return MODEL_LOGGING_ENABLED.value();
    }

    public static String getSynthesisPromptVersion() {
        return SYNTHESIS_PROMPT_VERSION.value();
    }

    /**
     * Returns the configured model prices keyed by model ID. Each value has the format
     * {@code <input price per 1M tokens>,<output price per 1M tokens>}.
     */
    public static Map<String, String> getModelPricingEntries() {
        var entries = new TreeMap<String, String>();
        properties.stringPropertyNames().stream()
                .filter(key -> key.startsWith(MODEL_PRICING_PREFIX))
                .forEach(key -> entries.put(key.substring(MODEL_PRICING_PREFIX.length()),
                        properties.getProperty(key).trim()));
        return entries;
    }

    // -----------------------------------------------------
    // Browser Config
    public static boolean isHeadless() {
        return HEADLESS.value();
    }

    public static BrowserType getBrowserType() {
        return BROWSER_TYPE.value();
    }

    public static int getDefaultTimeoutMillis() {
        return DEFAULT_TIMEOUT_MILLIS.value();
    }

    // -----------------------------------------------------
    // Repair Config
    public static int getMaxRepairAttempts() {
        return MAX_REPAIR_ATTEMPTS.value();
    }

    public static boolean isAutoHeal() {
        return AUTO_HEAL.value();
    }

    public static int getRepairHistoryWindow() {
        return REPAIR_HISTORY_WINDOW.value();
    }

    public static int getRepairUnknownStreakLimit() {
        return REPAIR_UNKNOWN_STREAK_LIMIT.value();
    }

    public static boolean isQuickFixesEnabled() {
        return QUICK_FIXES_ENABLED.value();
    }

    // -----------------------------------------------------
    // Budget Config
    public static BigDecimal getMaxCostPerRun() {
        return MAX_COST_PER_RUN.value();
    }

    public static BigDecimal getDailyBudget() {
        return DAILY_BUDGET.value();
    }

    public static Path getDailySpendFile() {
        return Path.of(DAILY_SPEND_FILE.value());
    }

    public static ZoneId getDailyResetZone() {
        return DAILY_RESET_ZONE.value();
    }

    public static Path getRunStoreDir() {
        return Path.of(RUN_STORE_DIR.value());
    }

    // -----------------------------------------------------
    // Timeout and Retry Config
    public static int getRunDeadlineMillis() {
        return RUN_DEADLINE_MILLIS.value();
    }

    public static int getExecutionGraceMillis() {
        return EXECUTION_GRACE_MILLIS.value();
    }

    public static RetryPolicy getSynthesisRetryPolicy() {
        return new RetryPolicy(
                SYNTHESIS_MAX_RETRIES.value(),
                SYNTHESIS_RETRY_INITIAL_DELAY_MILLIS.value(),
                SYNTHESIS_RETRY_MAX_DELAY_MILLIS.value(),
                SYNTHESIS_RETRY_BACKOFF_MULTIPLIER.value(),
                SYNTHESIS_RETRY_TIMEOUT_MILLIS.value()
        );
    }

    // -----------------------------------------------------
    // Execution Sandbox Config
    public static String getExecutionSandboxUrl() {
        return EXECUTION_SANDBOX_URL.value();
    }

    // -----------------------------------------------------
    // Private methods
    private static ModelProvider getModelProvider(String s) {
        return stream(ModelProvider.values())
                .filter(provider -> provider.name().equalsIgnoreCase(s))
                .findAny()
                .orElseThrow(() -> new IllegalArgumentException(
                        ("%s is not a supported model provider. Supported ones: %s".formatted(s,
                                Arrays.toString(ModelProvider.values())))));
    }

    private static BrowserType getBrowserType(String s) {
        return stream(BrowserType.values())
                .filter(type -> type.name().equalsIgnoreCase(s))
                .findAny()
                .orElseThrow(() -> new IllegalArgumentException(
                        ("%s is not a supported browser type. Supported ones: %s".formatted(s,
                                Arrays.toString(BrowserType.values())))));
    }

    private static Properties loadConfigPropertiesFromFile() {
        var properties = new Properties();
        try (InputStream inputStream = AgentConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                LOG.error("Cannot find resource file '{}' in classpath.", CONFIG_FILE);
                throw new IOException("Cannot find resource: " + CONFIG_FILE);
            }
            properties.load(new InputStreamReader(inputStream, UTF_8));
            LOG.info("Loaded properties from {}", CONFIG_FILE);
            return properties;
        } catch (IOException e) {
            LOG.error("Error loading properties file " + CONFIG_FILE, e);
            throw new UncheckedIOException(e);
        }
    }

    private static <T> ConfigProperty<T> loadProperty(String key, String envVar, String defaultValue,
            Function<String, T> converter,
            boolean isSecret) {
        var value = getProperty(key, envVar, defaultValue, isSecret);
        return new ConfigProperty<>(converter.apply(value), isSecret);
    }

    private static Optional<String> getProperty(String key, String envVar, boolean isSecret) {
        var envVariableOptional = ofNullable(envVar)
                .map(System::getenv)
                .map(String::trim)
                .filter(CommonUtils::isNotBlank);
        if (envVariableOptional.isPresent()) {
            var message = "Using environment variable '%s' for key '%s'".formatted(envVar, key);
            if (!isSecret) {
                message = "%s with value '%s'".formatted(message, envVariableOptional.get());
            }
            LOG.info(message);
            return envVariableOptional;
        } else {
            var propertyFileValueOptional = ofNullable(properties.getProperty(key))
                    .map(String::trim)
                    .filter(CommonUtils::isNotBlank);
            if (propertyFileValueOptional.isPresent()) {
                var message = "Using property file value for key '%s'".formatted(key);
                if (!isSecret) {
                    message = "%s with value '%s'".formatted(message, propertyFileValueOptional.get());
                }
                LOG.info(message);
                return propertyFileValueOptional;
            } else {
                return empty();
            }
        }
    }

    private static String getProperty(String key, String envVar, String defaultValue, boolean isSecret) {
        return getProperty(key, envVar, isSecret).orElseGet(() -> {
            LOG.info("Using default value for key '{}'", key);
            return defaultValue;
        });
    }

    private static <T> ConfigProperty<T> getProperty(String key, String envVar, String defaultValue,
            Function<String, T> converter,
            boolean isSecret) {
        String value = getProperty(key, envVar, defaultValue, isSecret);
        return new ConfigProperty<>(converter.apply(value), isSecret);
    }

    private static ConfigProperty<Integer> loadPropertyAsInteger(String propertyKey, String envVar, String defaultValue,
            boolean isSecret) {
        var configProperty = getProperty(propertyKey, envVar, defaultValue, s -> s, isSecret);
        Integer value = CommonUtils.parseStringAsInteger(configProperty.value())
                .orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not a correct integer value:%s".formatted(propertyKey,
                                configProperty.value())));
        return new ConfigProperty<>(value, configProperty.isSecret());
    }

    private static ConfigProperty<Double> loadPropertyAsDouble(String propertyKey, String envVar, String defaultValue,
            boolean isSecret) {
        var configProperty = getProperty(propertyKey, envVar, defaultValue, s -> s, isSecret);
        Double value = CommonUtils.parseStringAsDouble(configProperty.value())
                .orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not a correct double value:%s".formatted(propertyKey,
                                configProperty.value())));
        return new ConfigProperty<>(value, configProperty.isSecret());
    }

    private static ConfigProperty<BigDecimal> loadPropertyAsDecimal(String propertyKey, String envVar,
            String defaultValue, boolean isSecret) {
        var configProperty = getProperty(propertyKey, envVar, defaultValue, s -> s, isSecret);
        BigDecimal value = CommonUtils.parseStringAsDecimal(configProperty.value())
                .orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not a correct decimal value:%s".formatted(propertyKey,
                                configProperty.value())));
        return new ConfigProperty<>(value, configProperty.isSecret());
    }
}
