package com.railmadad.triage.service.aws;

/**
 * Common interface for LLM providers (AWS Bedrock, OpenAI).
 */
public interface LLMService {

  /**
   * Sends a single-turn prompt and returns the text of the reply.
   * @param prompt The prompt to send to the LLM
   * @return The LLM response
   * @throws Exception if the call fails
   */
  String complete(String prompt) throws Exception;

  /**
   * Gets the current model ID being used
   * @return The model identifier
   */
  String getCurrentModelId();

  /**
   * Checks if the service is properly configured
   * @return true if configured, false otherwise
   */
  boolean isConfigured();
}
