package classifier.model;

import java.util.Map;

/**
 * Body of a successful {@code POST /predict}. Percentages are pre-formatted, e.g. {@code "95.34%"}.
 */
public class PredictionResponse {

  private String filename;
  private String prediction;
  private String confidence;
  private Map<String, String> probabilities;
  private long inferenceTimeMs;
  private Long feedbackId;

  public String getFilename() {
    return filename;
  }

  public void setFilename(String filename) {
    this.filename = filename;
  }

  public String getPrediction() {
    return prediction;
  }

  public void setPrediction(String prediction) {
    this.prediction = prediction;
  }

  public String getConfidence() {
    return confidence;
  }

  public void setConfidence(String confidence) {
    this.confidence = confidence;
  }

  public Map<String, String> getProbabilities() {
    return probabilities;
  }

  public void setProbabilities(Map<String, String> probabilities) {
    this.probabilities = probabilities;
  }

  public long getInferenceTimeMs() {
    return inferenceTimeMs;
  }

  public void setInferenceTimeMs(long inferenceTimeMs) {
    this.inferenceTimeMs = inferenceTimeMs;
  }

  public Long getFeedbackId() {
    return feedbackId;
  }

  public void setFeedbackId(Long feedbackId) {
    this.feedbackId = feedbackId;
  }
}
