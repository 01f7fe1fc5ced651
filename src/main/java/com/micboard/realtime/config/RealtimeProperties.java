package com.micboard.realtime.config;

import com.micboard.realtime.model.ConnectionState;
import com.micboard.realtime.model.ConnectionType;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "micboard.realtime")
public class RealtimeProperties {

  @NotNull
  private Duration reconnectBaseDelay = Duration.ofSeconds(1);

  @NotNull
  private Duration reconnectMaxDelay = Duration.ofSeconds(60);

  @Min(0)
  private int maxReconnectAttempts = ConnectionState.DEFAULT_MAX_RECONNECT_ATTEMPTS;

  /** Longest silence on an open stream before it is treated as stale. Zero disables. */
  @NotNull
  private Duration messageTimeout = Duration.ZERO;

  @NotNull
  private Duration heartbeatTimeout = Duration.ofSeconds(60);

  /** How often the health summary is logged. Zero disables. */
  @NotNull
  private Duration healthReportInterval = Duration.ofMinutes(1);

  @NotBlank
  private String viewerPath = "/ws";

  @Min(1)
  private int viewerBufferSize = 256;

  @Valid
  private List<Device> devices = new ArrayList<>();

  @Data
  public static class Device {
    @NotBlank
    private String id;

    @NotNull
    private URI uri;

    @NotNull
    private ConnectionType connectionType = ConnectionType.WEBSOCKET;
  }
}
