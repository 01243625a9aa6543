package ca.gc.cra.helios.application.port;

import ca.gc.cra.helios.domain.state.PipelineState;
import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Durable storage for scheduler progress.
 * <p><strong>Why:</strong> A restarted scheduler resumes at the first unprocessed tick with its failure counter.</p>
 * <p><strong>Thread-safety:</strong> Only the scheduler thread calls a store.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.helios.infrastructure.state.JsonStateStore
 */
public interface StateStorePort {
  /**
   * Loads the last persisted state.
   *
   * @return persisted state, or empty when none exists or it cannot be used
   */
  Optional<PipelineState> load();

  /**
   * Replaces the persisted state atomically.
   *
   * @param state state to persist
   * @throws IOException if the state cannot be written
   */
  void save(PipelineState state) throws IOException;

  /** Store that persists nothing; used for one-shot backfills. */
  StateStorePort NONE = new StateStorePort() {
    @Override
    public Optional<PipelineState> load() {
      return Optional.empty();
    }

    @Override
    public void save(PipelineState state) {}
  };
}
