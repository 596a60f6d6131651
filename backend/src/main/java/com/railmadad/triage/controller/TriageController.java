package com.railmadad.triage.controller;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.railmadad.triage.dto.api.ChatComplaintRequest;
import com.railmadad.triage.dto.api.ChatComplaintResponse;
import com.railmadad.triage.dto.api.TriageRequest;
import com.railmadad.triage.dto.api.TriageResponse;
import com.railmadad.triage.dto.chat.ChatParseResult;
import com.railmadad.triage.dto.complaint.ComplaintDecision;
import com.railmadad.triage.dto.complaint.ComplaintInput;
import com.railmadad.triage.service.chat.ChatComplaintParser;
import com.railmadad.triage.service.triage.AcknowledgmentComposer;
import com.railmadad.triage.service.triage.TriageOrchestrator;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Complaint Triage", description = "Classify, deduplicate and route passenger complaints")
public class TriageController {

  private final TriageOrchestrator orchestrator;
  private final ChatComplaintParser chatParser;
  private final AcknowledgmentComposer acknowledgmentComposer;
  private final Clock clock;

  @PostMapping(
      value = "/complaints",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Triage a complaint",
      description =
          "Classifies the complaint, links it to similar recent reports and routes it to a department with a deadline")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Complaint registered",
            content = @Content(schema = @Schema(implementation = TriageResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(
            responseCode = "503",
            description = "Complaint could not be registered, retry",
            content = @Content)
      })
  public ResponseEntity<TriageResponse> triage(@Valid @RequestBody TriageRequest request) {
    log.info(
        "[TRIAGE-CONTROLLER] Received complaint: textLength={}, image={}, location={}",
        request.getText() != null ? request.getText().length() : 0,
        request.getImage() != null && request.getImage().length > 0,
        request.getLocation());

    ComplaintInput input =
        ComplaintInput.builder()
            .complaintId(request.getComplaintId())
            .text(request.getText())
            .imageBytes(request.getImage())
            .videoRef(request.getVideoRef())
            .reporterLocation(request.getLocation())
            .submittedAt(
                request.getSubmittedAt() != null ? request.getSubmittedAt() : Instant.now(clock))
            .build();

    ComplaintDecision decision = orchestrator.triage(input);
    return ResponseEntity.ok(
        TriageResponse.builder()
            .complaintId(decision.getComplaintId())
            .acknowledgment(acknowledgmentComposer.compose(decision))
            .decision(decision)
            .build());
  }

  @PostMapping(
      value = "/chat/complaints",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Register a complaint from a chat message",
      description =
          "Detects the message intent and journey details; complaint and emergency messages are triaged")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Message parsed",
            content = @Content(schema = @Schema(implementation = ChatComplaintResponse.class))),
        @ApiResponse(responseCode = "400", description = "Blank message", content = @Content),
        @ApiResponse(
            responseCode = "503",
            description = "Complaint could not be registered, retry",
            content = @Content)
      })
  public ResponseEntity<ChatComplaintResponse> chatComplaint(
      @Valid @RequestBody ChatComplaintRequest request) {
    ChatParseResult parsed = chatParser.parse(request.getMessage(), Instant.now(clock));
    log.info(
        "[TRIAGE-CONTROLLER] Chat message session={} intent={}",
        request.getSessionId(),
        parsed.getIntent());

    ChatComplaintResponse.ChatComplaintResponseBuilder response =
        ChatComplaintResponse.builder().intent(parsed.getIntent()).entities(parsed.getEntities());
    if (parsed.hasComplaint()) {
      ComplaintDecision decision = orchestrator.triage(parsed.getComplaint());
      response
          .complaintRegistered(true)
          .acknowledgment(acknowledgmentComposer.compose(decision))
          .decision(decision);
    }
    return ResponseEntity.ok(response.build());
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the triage service is up")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "UP", "timestamp", clock.millis()));
  }
}
