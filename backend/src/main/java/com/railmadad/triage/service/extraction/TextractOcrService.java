package com.railmadad.triage.service.extraction;

import java.util.stream.Collectors;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.railmadad.triage.config.TriageProperties;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextRequest;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextResponse;
import software.amazon.awssdk.services.textract.model.Document;

/** OCR through AWS Textract's synchronous DetectDocumentText API. */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "triage.ocr.provider", havingValue = "textract")
public class TextractOcrService implements OcrService {

  private final TriageProperties properties;
  private TextractClient textractClient;

  @PostConstruct
  public void init() {
    String region = properties.getOcr().getRegion();
    this.textractClient =
        TextractClient.builder()
            .region(Region.of(region))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .build();
    log.info("Textract OCR client initialized for region: {}", region);
  }

  void setTextractClient(TextractClient textractClient) {
    this.textractClient = textractClient;
  }

  @Override
  public String extractText(byte[] imageBytes) throws OcrException {
    if (imageBytes == null || imageBytes.length == 0) {
      return "";
    }

    DetectDocumentTextRequest request =
        DetectDocumentTextRequest.builder()
            .document(Document.builder().bytes(SdkBytes.fromByteArray(imageBytes)).build())
            .build();

    try {
      DetectDocumentTextResponse response = textractClient.detectDocumentText(request);
      String text =
          response.blocks().stream()
              .filter(block -> block.blockType() == BlockType.LINE)
              .map(Block::text)
              .collect(Collectors.joining("\n"));
      log.debug("Textract returned {} characters", text.length());
      return text;
    } catch (SdkException e) {
      throw new OcrException("Textract call failed: " + e.getMessage(), e);
    }
  }

  @Override
  public String getProviderName() {
    return "textract";
  }

  @PreDestroy
  public void close() {
    if (textractClient != null) {
      textractClient.close();
    }
  }
}
