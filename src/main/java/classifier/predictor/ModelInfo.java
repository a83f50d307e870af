package classifier.predictor;

import java.util.List;

public record ModelInfo(String name, String version, List<String> classes, String inputSize) {}
