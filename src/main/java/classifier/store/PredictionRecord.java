package classifier.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Optional;

/**
 * One row per inference attempt, successful or not.
 *
 * <p>
 * Everything except {@code userFeedback} and {@code userComment} is fixed at creation. Those two
 * are only amended through {@link FeedbackStore#updateFeedback}, which checks consent first.
 * </p>
 */
@Entity
@Table(
    name = "prediction_feedback",
    indexes = {
        @Index(name = "idx_prediction_feedback_timestamp", columnList = "created_at")
    }
)
public class PredictionRecord {

  public static final String RESULT_CAT = "cat";
  public static final String RESULT_DOG = "dog";
  public static final String RESULT_ERROR = "error";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant timestamp;

  @Column(nullable = false, updatable = false)
  private boolean success;

  @Column(name = "prediction_result", nullable = false, updatable = false, length = 10)
  private String predictionResult;

  @Column(name = "proba_cat", nullable = false, updatable = false)
  private double probaCat;

  @Column(name = "proba_dog", nullable = false, updatable = false)
  private double probaDog;

  @Column(name = "inference_time_ms", nullable = false, updatable = false)
  private long inferenceTimeMs;

  @Column(name = "rgpd_consent", nullable = false, updatable = false)
  private boolean rgpdConsent;

  @Column(updatable = false, length = 255)
  private String filename;

  @Column(name = "user_feedback")
  private Integer userFeedback;

  @Column(name = "user_comment", length = 2000)
  private String userComment;

  protected PredictionRecord() {
    // JPA
  }

  static PredictionRecord create(PredictionAttempt attempt, Instant timestamp) {
    PredictionRecord r = new PredictionRecord();
    r.timestamp = timestamp;
    r.success = attempt.success();
    r.predictionResult = attempt.predictionResult();
    r.probaCat = attempt.probaCat();
    r.probaDog = attempt.probaDog();
    r.inferenceTimeMs = attempt.inferenceTimeMs();
    r.rgpdConsent = attempt.rgpdConsent();
    r.filename = attempt.rgpdConsent() ? attempt.filename() : null;
    r.userComment = attempt.userComment();
    return r;
  }

  void applyFeedback(Integer userFeedback, String userComment) {
    if (userFeedback != null) {
      this.userFeedback = userFeedback;
    }
    if (userComment != null && !userComment.isBlank()) {
      this.userComment = userComment;
    }
  }

  public Long getId() {
    return id;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public boolean isSuccess() {
    return success;
  }

  public String getPredictionResult() {
    return predictionResult;
  }

  public double getProbaCat() {
    return probaCat;
  }

  public double getProbaDog() {
    return probaDog;
  }

  public long getInferenceTimeMs() {
    return inferenceTimeMs;
  }

  public boolean isRgpdConsent() {
    return rgpdConsent;
  }

  public Optional<String> getFilename() {
    return Optional.ofNullable(filename);
  }

  public Optional<Integer> getUserFeedback() {
    return Optional.ofNullable(userFeedback);
  }

  public Optional<String> getUserComment() {
    return Optional.ofNullable(userComment);
  }
}
