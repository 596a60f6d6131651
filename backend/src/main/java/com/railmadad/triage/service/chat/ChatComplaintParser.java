package com.railmadad.triage.service.chat;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.railmadad.triage.dto.chat.ChatEntities;
import com.railmadad.triage.dto.chat.ChatIntent;
import com.railmadad.triage.dto.chat.ChatParseResult;
import com.railmadad.triage.dto.complaint.ComplaintInput;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a chat message into a candidate complaint. Only the triage-relevant part of a chat is
 * handled here: intent detection, journey identifiers and the reporter location derived from
 * them.
 */
@Slf4j
@Component
public class ChatComplaintParser {

  private static final Map<ChatIntent, Pattern> INTENT_PATTERNS = new LinkedHashMap<>();

  static {
    INTENT_PATTERNS.put(
        ChatIntent.EMERGENCY,
        Pattern.compile(
            "\\b(emergency|urgent|theft|stolen|harassment|accident|medical|fire|smoke|danger|help)\\b"));
    INTENT_PATTERNS.put(
        ChatIntent.COMPLAINT,
        Pattern.compile(
            "\\b(complaint(?! id)|problem|issue|broken|dirty|not working|smells?|leaking|damaged|rude)\\b"));
    INTENT_PATTERNS.put(
        ChatIntent.STATUS,
        Pattern.compile("\\b(status|update|progress|complaint id|track|check)\\b"));
    INTENT_PATTERNS.put(
        ChatIntent.GREETING,
        Pattern.compile(
            "\\b(hello|hi|hey|namaste|good morning|good afternoon|good evening)\\b"));
    INTENT_PATTERNS.put(
        ChatIntent.THANKS, Pattern.compile("\\b(thanks|thank you|appreciate|grateful)\\b"));
  }

  private static final Pattern TRAIN_NUMBER = Pattern.compile("\\b\\d{5}\\b");
  private static final Pattern PNR = Pattern.compile("\\b\\d{10}\\b");
  private static final Pattern COACH = Pattern.compile("\\b[A-Z]{1,2}\\d{1,2}\\b");
  private static final Pattern SEAT =
      Pattern.compile("\\b(?:seat|berth)\\s*(?:no\\.?|number)?\\s*(\\d{1,3})\\b");

  private static final int MAX_SEAT = 100;

  /**
   * @throws IllegalArgumentException if the message is blank
   */
  public ChatParseResult parse(String message, Instant receivedAt) {
    if (message == null || message.isBlank()) {
      throw new IllegalArgumentException("Chat message must not be blank");
    }

    String lower = message.toLowerCase(Locale.ROOT);
    ChatIntent intent = detectIntent(lower);
    ChatEntities entities = extractEntities(message, lower);
    log.debug("Chat message intent={}, entities={}", intent, entities);

    ComplaintInput complaint = null;
    if (intent.isComplaint()) {
      complaint =
          ComplaintInput.builder()
              .text(message.trim())
              .submittedAt(receivedAt)
              .reporterLocation(locationOf(entities))
              .build();
    }
    return new ChatParseResult(intent, entities, complaint);
  }

  ChatIntent detectIntent(String lowerMessage) {
    for (Map.Entry<ChatIntent, Pattern> entry : INTENT_PATTERNS.entrySet()) {
      if (entry.getValue().matcher(lowerMessage).find()) {
        return entry.getKey();
      }
    }
    return ChatIntent.GENERAL;
  }

  private ChatEntities extractEntities(String message, String lowerMessage) {
    ChatEntities.ChatEntitiesBuilder entities = ChatEntities.builder();

    Matcher train = TRAIN_NUMBER.matcher(message);
    if (train.find()) {
      entities.trainNumber(train.group());
    }
    Matcher pnr = PNR.matcher(message);
    if (pnr.find()) {
      entities.pnr(pnr.group());
    }
    Matcher coach = COACH.matcher(message.toUpperCase(Locale.ROOT));
    if (coach.find()) {
      entities.coach(coach.group());
    }
    Matcher seat = SEAT.matcher(lowerMessage);
    if (seat.find()) {
      int number = Integer.parseInt(seat.group(1));
      if (number >= 1 && number <= MAX_SEAT) {
        entities.seat(number);
      }
    }
    return entities.build();
  }

  private static String locationOf(ChatEntities entities) {
    if (entities.getCoach() != null) {
      return "Coach-" + entities.getCoach();
    }
    if (entities.getTrainNumber() != null) {
      return "Train-" + entities.getTrainNumber();
    }
    return null;
  }
}
