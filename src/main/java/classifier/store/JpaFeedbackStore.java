package classifier.store;

import classifier.error.ConsentDeniedException;
import classifier.error.InvalidInputException;
import classifier.error.RecordNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Relational implementation backed by Spring Data JPA.
 *
 * <p>
 * - Each call is its own transaction.
 * - Amendments lock the target row, so concurrent updates of one id apply one after the other
 *   while updates of different ids never wait on each other.
 * </p>
 */
@Component
public class JpaFeedbackStore implements FeedbackStore {
  private static final Logger log = LoggerFactory.getLogger(JpaFeedbackStore.class);

  private final PredictionRecordRepository repository;
  private final Clock clock;

  public JpaFeedbackStore(PredictionRecordRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  @Transactional
  public PredictionRecord save(PredictionAttempt attempt) {
    if (attempt == null) {
      throw new IllegalArgumentException("attempt must not be null");
    }
    PredictionRecord saved = repository.save(PredictionRecord.create(attempt, Instant.now(clock)));
    log.info("event=store.saved feedbackId={} success={} result={} inferenceTimeMs={} rgpdConsent={}",
        saved.getId(), saved.isSuccess(), saved.getPredictionResult(), saved.getInferenceTimeMs(), saved.isRgpdConsent());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<PredictionRecord> find(long id) {
    return repository.findById(id);
  }

  @Override
  @Transactional
  public PredictionRecord updateFeedback(long id, Integer userFeedback, String userComment) {
    PredictionRecord record = repository.findByIdForUpdate(id)
        .orElseThrow(() -> new RecordNotFoundException(id));
    if (!record.isRgpdConsent()) {
      throw new ConsentDeniedException(id);
    }
    // existence and consent are answered before the payload is looked at
    if (userFeedback != null && userFeedback != 0 && userFeedback != 1) {
      throw new InvalidInputException("user_feedback must be 0 or 1, got " + userFeedback);
    }
    if (userComment != null && userComment.length() > PredictionAttempt.MAX_COMMENT_LENGTH) {
      throw new InvalidInputException(
          "user_comment must not exceed " + PredictionAttempt.MAX_COMMENT_LENGTH + " characters");
    }
    record.applyFeedback(userFeedback, userComment);
    // flush inside the transaction so a constraint failure rolls back here, not at commit time
    repository.saveAndFlush(record);
    log.info("event=store.feedback_updated feedbackId={} userFeedback={} commentChars={}",
        id, userFeedback, userComment == null ? 0 : userComment.length());
    return record;
  }

  @Override
  @Transactional(readOnly = true)
  public List<PredictionRecord> findRecent(int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return repository.findAllByOrderByTimestampDescIdDesc(PageRequest.of(0, limit));
  }
}
