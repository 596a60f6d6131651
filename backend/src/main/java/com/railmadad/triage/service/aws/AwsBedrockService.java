package com.railmadad.triage.service.aws;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.AccessDeniedException;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;
import software.amazon.awssdk.services.bedrockruntime.model.ThrottlingException;
import software.amazon.awssdk.services.bedrockruntime.model.ValidationException;

/**
 * Calls a Bedrock-hosted model through the unified Converse API. The client is built at startup
 * from the default AWS credential chain when {@code aws.bedrock.enabled} is set.
 */
@Slf4j
@Service
public class AwsBedrockService implements LLMService {

  private BedrockRuntimeClient bedrockRuntimeClient;

  @Value("${aws.bedrock.enabled:false}")
  private boolean enabled;

  @Value("${aws.bedrock.model-id:}")
  private String modelId;

  @Value("${aws.region:us-east-1}")
  private String defaultAwsRegion;

  @Value("${aws.bedrock.retry.max-attempts:3}")
  private int maxRetryAttempts;

  @Value("${aws.bedrock.retry.initial-delay-ms:100}")
  private long initialRetryDelayMs;

  @Value("${aws.bedrock.retry.max-delay-ms:400}")
  private long maxRetryDelayMs;

  @Value("${aws.bedrock.retry.jitter-ms:50}")
  private long retryJitterMs;

  @Value("${aws.bedrock.max-tokens:256}")
  private int maxTokens;

  @Value("${aws.bedrock.temperature:0}")
  private double temperature;

  private String currentRegion;

  @PostConstruct
  public void init() {
    if (enabled) {
      initializeClient(DefaultCredentialsProvider.create(), defaultAwsRegion);
    } else {
      log.info("AWS Bedrock disabled (aws.bedrock.enabled=false)");
    }
  }

  public void initializeClient(AwsCredentialsProvider credentialsProvider, String region) {
    this.currentRegion = region != null ? region : defaultAwsRegion;
    this.bedrockRuntimeClient =
        BedrockRuntimeClient.builder()
            .region(Region.of(currentRegion))
            .credentialsProvider(credentialsProvider)
            .build();

    log.info("AWS Bedrock client initialized for region: {} with model: {}", currentRegion, modelId);
  }

  public boolean isInitialized() {
    return bedrockRuntimeClient != null;
  }

  @Override
  public boolean isConfigured() {
    return isInitialized() && modelId != null && !modelId.trim().isEmpty();
  }

  public String getCurrentRegion() {
    return currentRegion;
  }

  @Override
  public String getCurrentModelId() {
    return modelId;
  }

  @PreDestroy
  public void close() {
    if (bedrockRuntimeClient != null) {
      bedrockRuntimeClient.close();
      bedrockRuntimeClient = null;
      log.info("AWS Bedrock client closed");
    }
  }

  /**
   * Invokes the model using the Converse API, retrying with exponential backoff on throttling.
   *
   * @param prompt The prompt to send to the model
   * @return The model's response text
   * @throws Exception if the invocation fails
   */
  @Override
  public String complete(String prompt) throws Exception {
    if (!isInitialized()) {
      throw new IllegalStateException(
          "AWS Bedrock client not initialized. Set aws.bedrock.enabled=true and provide credentials.");
    }

    if (modelId == null || modelId.trim().isEmpty()) {
      throw new IllegalStateException("No Bedrock model configured. Set aws.bedrock.model-id.");
    }

    log.debug("Sending prompt to AWS Bedrock model {}:\n{}", modelId, prompt);

    ContentBlock contentBlock = ContentBlock.builder().text(prompt).build();
    Message userMessage =
        Message.builder().role(ConversationRole.USER).content(contentBlock).build();
    InferenceConfiguration inferenceConfig =
        InferenceConfiguration.builder()
            .maxTokens(maxTokens)
            .temperature((float) temperature)
            .build();
    ConverseRequest converseRequest =
        ConverseRequest.builder()
            .modelId(modelId)
            .messages(List.of(userMessage))
            .inferenceConfig(inferenceConfig)
            .build();

    int attempt = 0;
    long retryDelay = initialRetryDelayMs;

    while (attempt < maxRetryAttempts) {
      try {
        ConverseResponse response = bedrockRuntimeClient.converse(converseRequest);

        Message responseMessage = response.output().message();
        if (responseMessage != null && !responseMessage.content().isEmpty()) {
          ContentBlock responseContent = responseMessage.content().get(0);
          if (responseContent.text() != null) {
            return responseContent.text();
          }
        }

        throw new IllegalStateException("No content in model response");

      } catch (ThrottlingException e) {
        attempt++;
        if (attempt >= maxRetryAttempts) {
          log.error("Max retry attempts ({}) reached for AWS Bedrock throttling", maxRetryAttempts);
          throw new RuntimeException(
              String.format(
                  "AWS Bedrock throttling error after %d retry attempts", maxRetryAttempts),
              e);
        }

        log.warn(
            "AWS Bedrock throttling detected. Retrying in {} ms (attempt {}/{})",
            retryDelay,
            attempt,
            maxRetryAttempts);

        try {
          Thread.sleep(retryDelay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new RuntimeException("Retry interrupted", ie);
        }

        retryDelay =
            Math.min(retryDelay * 2 + (long) (Math.random() * retryJitterMs), maxRetryDelayMs);

      } catch (AccessDeniedException e) {
        log.error("Access denied to AWS Bedrock model: {}", modelId, e);
        throw new RuntimeException(
            String.format(
                "Access denied to model '%s' in region %s", modelId, currentRegion),
            e);
      } catch (ValidationException e) {
        log.error("Validation error for model: {}", modelId, e);
        throw new RuntimeException(
            String.format(
                "Model '%s' rejected the request in region %s: %s",
                modelId, currentRegion, e.getMessage()),
            e);
      } catch (IllegalStateException e) {
        throw e;
      } catch (Exception e) {
        log.error("Error invoking model: {}", modelId, e);
        throw new RuntimeException("Bedrock invocation failed: " + e.getMessage(), e);
      }
    }

    throw new RuntimeException("Failed to invoke AWS Bedrock model after all retry attempts");
  }
}
