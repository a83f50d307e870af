package classifier.predictor;

/**
 * The classification model, seen from the gateway as a black box.
 *
 * <p>
 * Implementations must be safe to call from concurrent request threads.
 * </p>
 */
public interface Predictor {

  /**
   * Whether the model finished loading and can serve predictions.
   */
  boolean isLoaded();

  /**
   * Classifies the raw image bytes.
   *
   * @throws Exception any failure of the model, reported to the caller as an inference failure
   */
  ClassificationResult predict(byte[] imageData) throws Exception;

  ModelInfo info();
}
