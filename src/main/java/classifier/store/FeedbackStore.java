package classifier.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable log of every inference attempt and the satisfaction signal users attach to it later.
 *
 * <p>
 * - Records are keyed by their generated id, which is the only handle given to clients.
 * - Persistence errors propagate as Spring {@code DataAccessException}s; nothing is retried here.
 * </p>
 */
public interface FeedbackStore {

  /**
   * Persists a new record for the attempt and returns it with its id assigned.
   */
  PredictionRecord save(PredictionAttempt attempt);

  Optional<PredictionRecord> find(long id);

  /**
   * Applies a partial feedback update, all or nothing.
   *
   * @param userFeedback 0 or 1, or {@code null} to leave it as is
   * @param userComment free text, or {@code null}/blank to leave it as is
   * @throws classifier.error.RecordNotFoundException if no record has this id
   * @throws classifier.error.ConsentDeniedException if the record was created without consent
   * @throws classifier.error.InvalidInputException if the record accepts amendments but the
   *     feedback is not 0/1 or the comment is too long
   */
  PredictionRecord updateFeedback(long id, Integer userFeedback, String userComment);

  /**
   * Newest records first, at most {@code limit}.
   */
  List<PredictionRecord> findRecent(int limit);
}
