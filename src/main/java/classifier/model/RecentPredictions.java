package classifier.model;

import java.util.List;

public record RecentPredictions(List<RecentPrediction> predictions, int count) {

  public static RecentPredictions of(List<RecentPrediction> predictions) {
    return new RecentPredictions(predictions, predictions.size());
  }
}
