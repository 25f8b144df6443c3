/*
 * Copyright 2025 Pretium Engineering Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package pretium.reporting.config;

import java.time.Duration;
import java.util.Optional;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * LangChain4j configuration for the model that drafts reports.
 *
 * <p>
 * Validates at startup that an Anthropic API key is present and produces the single {@link ChatModel} used by
 * {@link pretium.reporting.services.ReportGenerationService}.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code report.ai.api-key} - Anthropic API key (from ANTHROPIC_API_KEY env var)</li>
 * <li>{@code report.ai.model-name} - model name (default: claude-3-5-sonnet-20241022)</li>
 * <li>{@code report.ai.temperature} - sampling temperature (default: 0.4)</li>
 * <li>{@code report.ai.max-tokens} - max output tokens (default: 8192)</li>
 * <li>{@code report.ai.timeout-seconds} - per-call timeout (default: 120)</li>
 * <li>{@code report.ai.max-retries} - retry attempts inside the client (default: 2)</li>
 * </ul>
 */
@ApplicationScoped
@Startup
public class AiConfig {

    private static final Logger LOG = Logger.getLogger(AiConfig.class);

    @ConfigProperty(
            name = "report.ai.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "report.ai.model-name",
            defaultValue = "claude-3-5-sonnet-20241022")
    String modelName;

    @ConfigProperty(
            name = "report.ai.temperature",
            defaultValue = "0.4")
    double temperature;

    @ConfigProperty(
            name = "report.ai.max-tokens",
            defaultValue = "8192")
    int maxTokens;

    @ConfigProperty(
            name = "report.ai.timeout-seconds",
            defaultValue = "120")
    int timeoutSeconds;

    @ConfigProperty(
            name = "report.ai.max-retries",
            defaultValue = "2")
    int maxRetries;

    /**
     * Fails startup when no API key is configured.
     *
     * @throws AiConfigurationException
     *             if the Anthropic API key is missing or blank
     */
    @PostConstruct
    public void validateConfiguration() {
        if (apiKey.isEmpty() || apiKey.get().trim().isEmpty()) {
            String errorMessage = "ANTHROPIC_API_KEY environment variable is not configured. "
                    + "Report generation requires a valid Anthropic API key. "
                    + "Set ANTHROPIC_API_KEY (report.ai.api-key) and restart the application.";
            LOG.fatal(errorMessage);
            throw new AiConfigurationException(errorMessage);
        }
        LOG.infof("LangChain4j configured for report generation with model %s", modelName);
    }

    @Produces
    @ApplicationScoped
    public ChatModel createReportModel() {
        LOG.infof("Creating report ChatModel: model=%s, temperature=%.2f, maxTokens=%d, timeout=%ds, maxRetries=%d",
                modelName, temperature, maxTokens, timeoutSeconds, maxRetries);

        return AnthropicChatModel.builder().apiKey(apiKey.orElseThrow()).modelName(modelName)
                .temperature(temperature).maxTokens(maxTokens).timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries).logRequests(false).logResponses(false).build();
    }

    /**
     * Exception thrown when AI configuration is invalid or incomplete.
     */
    public static class AiConfigurationException extends RuntimeException {

        public AiConfigurationException(String message) {
            super(message);
        }
    }
}
