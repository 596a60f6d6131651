package com.railmadad.triage.dto.chat;

import com.railmadad.triage.dto.complaint.ComplaintInput;

import lombok.Value;

@Value
public class ChatParseResult {

  ChatIntent intent;
  ChatEntities entities;

  /** Present only for complaint-like intents. */
  ComplaintInput complaint;

  public boolean hasComplaint() {
    return complaint != null;
  }
}
