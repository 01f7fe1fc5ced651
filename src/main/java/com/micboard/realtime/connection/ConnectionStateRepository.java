package com.micboard.realtime.connection;

import com.micboard.realtime.model.ConnectionState;
import java.util.List;
import java.util.Optional;

/** Storage for connection states, one per device. */
public interface ConnectionStateRepository {

  Optional<ConnectionState> load(String deviceId);

  ConnectionState save(ConnectionState state);

  List<ConnectionState> findAll();

  boolean delete(String deviceId);
}
