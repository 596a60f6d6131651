package com.railmadad.triage.service.aws;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
@DisplayName("OpenAIService Tests")
class OpenAIServiceTest {

  @Mock private RestTemplate restTemplate;

  private OpenAIService openAIService;

  @BeforeEach
  void setUp() {
    openAIService = new OpenAIService(new ObjectMapper(), restTemplate);
    ReflectionTestUtils.setField(openAIService, "openaiApiKey", "sk-test");
    ReflectionTestUtils.setField(openAIService, "model", "gpt-4o-mini");
    ReflectionTestUtils.setField(openAIService, "maxTokens", 256);
    ReflectionTestUtils.setField(openAIService, "temperature", 0.0);
    ReflectionTestUtils.setField(openAIService, "maxRetryAttempts", 2);
    ReflectionTestUtils.setField(openAIService, "retryDelayMs", 1L);
    ReflectionTestUtils.setField(openAIService, "apiUrl", "http://localhost/v1/chat/completions");
  }

  @Test
  void shouldReturnFirstChoiceContent() throws Exception {
    // Given
    when(restTemplate.exchange(
            anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
        .thenReturn(
            ResponseEntity.ok("{\"choices\":[{\"message\":{\"content\":\"{\\\"STAFF\\\":1}\"}}]}"));

    // When
    String content = openAIService.complete("rude attendant");

    // Then
    assertThat(content).isEqualTo("{\"STAFF\":1}");
  }

  @Test
  void shouldRetryAndFailAfterMaxAttempts() {
    // Given
    when(restTemplate.exchange(
            anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
        .thenThrow(new ResourceAccessException("timeout"));

    // When/Then
    assertThatThrownBy(() -> openAIService.complete("rude attendant"))
        .isInstanceOf(RuntimeException.class)
        .hasMessageContaining("failed after 2 attempts");
    verify(restTemplate, times(2))
        .exchange(anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class));
  }

  @Test
  void shouldRefuseWithoutApiKey() {
    ReflectionTestUtils.setField(openAIService, "openaiApiKey", "");

    assertThat(openAIService.isConfigured()).isFalse();
    assertThatThrownBy(() -> openAIService.complete("x"))
        .isInstanceOf(IllegalStateException.class);
  }
}
