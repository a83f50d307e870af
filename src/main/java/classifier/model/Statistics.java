package classifier.model;

import java.util.Map;

/**
 * Aggregates over the whole feedback store. Rates are percentages rounded to two decimals.
 */
public record Statistics(
    long totalPredictions,
    double avgInferenceTimeMs,
    double successRatePct,
    double satisfactionRatePct,
    Map<String, Long> predictionsByClass
) {}
