package classifier.predictor;

import classifier.config.PredictorConfig.PredictorProperties;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stand-in for the CNN: the image is decoded for real, the probabilities are derived from its
 * mean colour balance, and a configurable latency is simulated.
 *
 * <p>
 * Model quality is not the point here. The output is deterministic for identical bytes so
 * the observability pipeline can be exercised end to end.
 * </p>
 */
@Component
public class SimulatedPredictor implements Predictor {
  private static final Logger log = LoggerFactory.getLogger(SimulatedPredictor.class);

  private final PredictorProperties props;

  public SimulatedPredictor(PredictorProperties props) {
    this.props = props;
    log.info("event=predictor.init loaded={} name=\"{}\" version={}", props.loaded(), props.name(), props.version());
  }

  @Override
  public boolean isLoaded() {
    return props.loaded();
  }

  @Override
  public ClassificationResult predict(byte[] imageData) throws Exception {
    BufferedImage image = decode(imageData);
    simulateWork();
    return ClassificationResult.of(catScore(image));
  }

  @Override
  public ModelInfo info() {
    return new ModelInfo(
        props.name(),
        props.version(),
        List.of(ClassificationResult.CAT, ClassificationResult.DOG),
        props.imageSize() + "x" + props.imageSize());
  }

  private static BufferedImage decode(byte[] imageData) throws IOException {
    if (imageData == null || imageData.length == 0) {
      throw new IOException("empty image payload");
    }
    BufferedImage image = ImageIO.read(new ByteArrayInputStream(imageData));
    if (image == null) {
      throw new IOException("unsupported or corrupted image data");
    }
    return image;
  }

  // warm (red-dominant) images lean "cat", cool ones lean "dog"
  private static double catScore(BufferedImage image) {
    int stepX = Math.max(1, image.getWidth() / 32);
    int stepY = Math.max(1, image.getHeight() / 32);
    long red = 0;
    long blue = 0;
    for (int y = 0; y < image.getHeight(); y += stepY) {
      for (int x = 0; x < image.getWidth(); x += stepX) {
        int rgb = image.getRGB(x, y);
        red += (rgb >> 16) & 0xff;
        blue += rgb & 0xff;
      }
    }
    double total = red + blue;
    if (total == 0) {
      return 0.5;
    }
    // keep away from 0/1 so neither class is ever certain
    return 0.02 + 0.96 * (red / total);
  }

  private void simulateWork() throws InterruptedException {
    int lo = Math.max(0, props.simulatedMinMs());
    int hi = Math.max(lo, props.simulatedMaxMs());
    int plannedMs = lo == hi ? lo : ThreadLocalRandom.current().nextInt(lo, hi + 1);
    if (plannedMs > 0) {
      Thread.sleep(plannedMs);
    }
  }
}
