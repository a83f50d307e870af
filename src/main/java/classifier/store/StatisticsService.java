package classifier.store;

import classifier.model.RecentPrediction;
import classifier.model.RecentPredictions;
import classifier.model.Statistics;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Aggregates computed over the full store at call time.
 *
 * <p>
 * The queries run in one read-only transaction; the fields are not required to describe a
 * single snapshot, only to be individually correct.
 * </p>
 */
@Service
public class StatisticsService {

  private final PredictionRecordRepository repository;
  private final FeedbackStore store;

  public StatisticsService(PredictionRecordRepository repository, FeedbackStore store) {
    this.repository = repository;
    this.store = store;
  }

  @Transactional(readOnly = true)
  public Statistics statistics() {
    long total = repository.count();
    long successes = repository.countBySuccessTrue();
    long positive = repository.countByUserFeedback(1);
    long withFeedback = repository.countByUserFeedbackIsNotNull();
    Double avg = repository.averageInferenceTimeMs();

    Map<String, Long> byClass = new LinkedHashMap<>();
    byClass.put(PredictionRecord.RESULT_CAT, 0L);
    byClass.put(PredictionRecord.RESULT_DOG, 0L);
    for (PredictionRecordRepository.ClassCount c : repository.countSuccessfulByClass()) {
      byClass.put(c.getLabel(), c.getTotal() == null ? 0L : c.getTotal());
    }

    return new Statistics(
        total,
        round2(avg == null ? 0.0 : avg),
        percentage(successes, total),
        percentage(positive, withFeedback),
        byClass);
  }

  public RecentPredictions recentPredictions(int limit) {
    return RecentPredictions.of(store.findRecent(limit).stream()
        .map(RecentPrediction::from)
        .toList());
  }

  static double percentage(long part, long whole) {
    if (whole <= 0) {
      return 0.0;
    }
    return round2(part * 100.0 / whole);
  }

  private static double round2(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }
}
