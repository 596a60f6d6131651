package com.railmadad.triage.dto.chat;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/** Journey identifiers found in a chat message; absent ones are null. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatEntities {

  @JsonProperty("train_number")
  String trainNumber;

  @JsonProperty("coach")
  String coach;

  @JsonProperty("seat")
  Integer seat;

  @JsonProperty("pnr")
  String pnr;
}
