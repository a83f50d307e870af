package classifier.predictor;

/**
 * Model output. Probabilities are fractions in [0, 1] and sum to 1.
 */
public record ClassificationResult(String prediction, double probabilityCat, double probabilityDog) {

  public static final String CAT = "Cat";
  public static final String DOG = "Dog";

  public static ClassificationResult of(double probabilityCat) {
    double cat = Math.max(0.0, Math.min(1.0, probabilityCat));
    double dog = 1.0 - cat;
    return new ClassificationResult(cat >= dog ? CAT : DOG, cat, dog);
  }

  public double confidence() {
    return Math.max(probabilityCat, probabilityDog);
  }
}
