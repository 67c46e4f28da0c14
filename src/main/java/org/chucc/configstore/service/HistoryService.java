package org.chucc.configstore.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.chucc.configstore.event.ConfigEventSerializer;
import org.chucc.configstore.eventlog.RecordedEvent;
import org.chucc.configstore.repository.ConfigValueRepository;
import org.springframework.stereotype.Service;

/**
 * Service for the audit history of configuration keys.
 * Always reads the event log, never the projection.
 */
@Service
public class HistoryService {

  private final ConfigValueRepository repository;
  private final ConfigEventSerializer serializer;

  /**
   * Constructor for HistoryService.
   *
   * @param repository the aggregate repository
   * @param serializer the event codec
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring-managed beans are intentionally shared references"
  )
  public HistoryService(ConfigValueRepository repository, ConfigEventSerializer serializer) {
    this.repository = repository;
    this.serializer = serializer;
  }

  /**
   * Lists every event recorded for a key, oldest first.
   *
   * @param key the configuration key
   * @return the history, empty if the key was never written
   */
  public List<HistoryEntry> history(String key) {
    return repository.history(key).stream()
        .map(this::toHistoryEntry)
        .toList();
  }

  private HistoryEntry toHistoryEntry(RecordedEvent recorded) {
    return new HistoryEntry(
        recorded.eventType(),
        serializer.toMap(recorded.event()),
        recorded.metadata(),
        recorded.recordedAt(),
        recorded.streamVersion());
  }
}
