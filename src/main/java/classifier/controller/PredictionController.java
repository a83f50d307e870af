package classifier.controller;

import classifier.model.FeedbackAck;
import classifier.model.PredictionResponse;
import classifier.model.PredictionUpload;
import classifier.service.ApiTokenVerifier;
import classifier.service.PredictionService;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
public class PredictionController {
  private static final Logger log = LoggerFactory.getLogger(PredictionController.class);

  private final PredictionService predictionService;
  private final ApiTokenVerifier tokenVerifier;

  public PredictionController(PredictionService predictionService, ApiTokenVerifier tokenVerifier) {
    this.predictionService = predictionService;
    this.tokenVerifier = tokenVerifier;
  }

  /**
   * Classifies an uploaded image:
   * - 200 with prediction and the feedback_id to amend later
   * - 401 bad token, 400 not an image, 503 model not loaded, 500 inference failed
   */
  @PostMapping(path = "/predict", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<PredictionResponse> predict(
      @RequestPart("file") MultipartFile file,
      @RequestParam(value = "rgpd_consent", defaultValue = "false") boolean rgpdConsent,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization
  ) throws IOException {
    tokenVerifier.verify(authorization);
    log.info("event=predict.received contentType={} sizeBytes={} rgpdConsent={}",
        file.getContentType(), file.getSize(), rgpdConsent);

    PredictionUpload upload = new PredictionUpload(
        file.getOriginalFilename(),
        file.getContentType(),
        file.getBytes(),
        rgpdConsent);
    return ResponseEntity.ok(predictionService.predict(upload));
  }

  /**
   * Attaches user satisfaction and/or a comment to a stored prediction:
   * - 200 recorded
   * - 404 unknown feedback_id, 403 no RGPD consent on that record, 400 bad values
   */
  @PostMapping("/feedback")
  public ResponseEntity<FeedbackAck> feedback(
      @RequestParam("feedback_id") long feedbackId,
      @RequestParam(value = "user_feedback", required = false) Integer userFeedback,
      @RequestParam(value = "user_comment", required = false) String userComment
  ) {
    log.info("event=feedback.received feedbackId={} userFeedback={}", feedbackId, userFeedback);
    return ResponseEntity.ok(predictionService.amendFeedback(feedbackId, userFeedback, userComment));
  }
}
