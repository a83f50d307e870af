package classifier.monitoring;

import java.util.Locale;

public enum FeedbackPolarity {
  POSITIVE,
  NEGATIVE;

  /**
   * 1 is satisfied, anything else counts as unsatisfied.
   */
  public static FeedbackPolarity fromUserFeedback(int userFeedback) {
    return userFeedback == 1 ? POSITIVE : NEGATIVE;
  }

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
