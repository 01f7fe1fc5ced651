package com.micboard.realtime.model;

import java.net.URI;
import javax.annotation.Nonnull;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeviceEndpoint {
  @Nonnull String deviceId;

  @Nonnull URI uri;

  @Nonnull ConnectionType connectionType;
}
