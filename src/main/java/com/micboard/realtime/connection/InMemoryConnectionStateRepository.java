package com.micboard.realtime.connection;

import com.micboard.realtime.model.ConnectionState;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryConnectionStateRepository implements ConnectionStateRepository {

  private final Map<String, ConnectionState> states = new ConcurrentHashMap<>();

  @Override
  public Optional<ConnectionState> load(String deviceId) {
    return Optional.ofNullable(states.get(deviceId));
  }

  @Override
  public ConnectionState save(ConnectionState state) {
    states.put(state.getDeviceId(), state);
    return state;
  }

  @Override
  public List<ConnectionState> findAll() {
    return new ArrayList<>(states.values());
  }

  @Override
  public boolean delete(String deviceId) {
    return states.remove(deviceId) != null;
  }
}
