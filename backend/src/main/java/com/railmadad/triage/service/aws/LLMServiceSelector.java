package com.railmadad.triage.service.aws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses between OpenAI and AWS Bedrock based on {@code llm.provider}, falling back to whichever
 * provider is configured.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LLMServiceSelector {

  private final AwsBedrockService awsBedrockService;
  private final OpenAIService openAIService;

  @Value("${llm.provider:openai}")
  private String preferredProvider;

  /**
   * @return The configured LLM service
   * @throws IllegalStateException if no service is configured
   */
  public LLMService getLLMService() {
    if ("openai".equalsIgnoreCase(preferredProvider) && openAIService.isConfigured()) {
      log.debug("Using OpenAI service for LLM calls");
      return openAIService;
    }

    if ("bedrock".equalsIgnoreCase(preferredProvider) && awsBedrockService.isConfigured()) {
      log.debug("Using AWS Bedrock service for LLM calls");
      return awsBedrockService;
    }

    if (openAIService.isConfigured()) {
      log.debug("Preferred provider {} not available, falling back to OpenAI", preferredProvider);
      return openAIService;
    }

    if (awsBedrockService.isConfigured()) {
      log.debug(
          "Preferred provider {} not available, falling back to AWS Bedrock", preferredProvider);
      return awsBedrockService;
    }

    throw new IllegalStateException(
        "No LLM service is configured. Set openai.api-key or enable aws.bedrock with a model id.");
  }

  /**
   * @return The provider name ("openai" or "bedrock")
   */
  public String getActiveProvider() {
    LLMService service = getLLMService();
    if (service instanceof OpenAIService) {
      return "openai";
    } else if (service instanceof AwsBedrockService) {
      return "bedrock";
    }
    return "unknown";
  }
}
