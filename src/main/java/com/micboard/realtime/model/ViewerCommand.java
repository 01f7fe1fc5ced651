package com.micboard.realtime.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ViewerCommand {
  public static final String PING = "ping";

  protected String command;

  public boolean isPing() {
    return PING.equals(command);
  }
}
