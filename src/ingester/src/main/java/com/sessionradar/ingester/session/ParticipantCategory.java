package com.sessionradar.ingester.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Kind of network participant. The id prefix is part of every persisted session id. */
public enum ParticipantCategory {
  @JsonProperty("controller")
  CONTROLLER("atc"),
  @JsonProperty("pilot")
  PILOT("pilot");

  private final String idPrefix;

  ParticipantCategory(String idPrefix) {
    this.idPrefix = idPrefix;
  }

  public String idPrefix() {
    return idPrefix;
  }
}
