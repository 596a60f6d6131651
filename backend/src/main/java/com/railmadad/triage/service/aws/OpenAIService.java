package com.railmadad.triage.service.aws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chat-completions client for OpenAI, the alternative to AWS Bedrock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAIService implements LLMService {

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;

  @Value("${openai.api-key:}")
  private String openaiApiKey;

  @Value("${openai.model:gpt-4o-mini}")
  private String model;

  @Value("${openai.max-tokens:256}")
  private int maxTokens;

  @Value("${openai.temperature:0}")
  private double temperature;

  @Value("${openai.retry.max-attempts:2}")
  private int maxRetryAttempts;

  @Value("${openai.retry.delay-ms:100}")
  private long retryDelayMs;

  @Value("${openai.api-url:https://api.openai.com/v1/chat/completions}")
  private String apiUrl;

  @Override
  public boolean isConfigured() {
    return openaiApiKey != null && !openaiApiKey.trim().isEmpty();
  }

  @Override
  public String complete(String prompt) throws Exception {
    if (!isConfigured()) {
      throw new IllegalStateException("OpenAI API key not configured. Set openai.api-key.");
    }

    log.debug("OpenAI request model={}, maxTokens={}, temperature={}", model, maxTokens, temperature);

    ObjectNode requestBody = objectMapper.createObjectNode();
    requestBody.put("model", model);
    requestBody.put("max_tokens", maxTokens);
    requestBody.put("temperature", temperature);

    ArrayNode messages = objectMapper.createArrayNode();
    ObjectNode message = objectMapper.createObjectNode();
    message.put("role", "user");
    message.put("content", prompt);
    messages.add(message);
    requestBody.set("messages", messages);

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setBearerAuth(openaiApiKey);

    HttpEntity<String> entity = new HttpEntity<>(requestBody.toString(), headers);

    int attempt = 0;
    while (attempt < maxRetryAttempts) {
      try {
        ResponseEntity<String> response =
            restTemplate.exchange(apiUrl, HttpMethod.POST, entity, String.class);

        if (response.getBody() != null) {
          JsonNode choices = objectMapper.readTree(response.getBody()).get("choices");

          if (choices != null && choices.isArray() && choices.size() > 0) {
            JsonNode messageNode = choices.get(0).get("message");
            if (messageNode != null && messageNode.has("content")) {
              String content = messageNode.get("content").asText();
              log.debug("OpenAI response content length={} chars", content.length());
              return content;
            }
          }
        }

        log.error(
            "Invalid response format from OpenAI API: status={}, bodyPresent={}",
            response.getStatusCode(),
            response.getBody() != null);
        throw new IllegalStateException("Invalid response format from OpenAI API");

      } catch (Exception e) {
        attempt++;
        log.warn("OpenAI API call attempt {} failed: {}", attempt, e.getMessage());

        if (attempt >= maxRetryAttempts) {
          throw new RuntimeException(
              "OpenAI API call failed after " + maxRetryAttempts + " attempts", e);
        }

        try {
          Thread.sleep(retryDelayMs * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new RuntimeException("Interrupted during retry", ie);
        }
      }
    }

    throw new RuntimeException("Failed to get response from OpenAI API");
  }

  @Override
  public String getCurrentModelId() {
    return model;
  }
}
