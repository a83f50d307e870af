package classifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import classifier.predictor.ClassificationResult;
import classifier.predictor.Predictor;
import classifier.store.FeedbackStore;
import classifier.store.PredictionAttempt;
import classifier.store.PredictionRecord;
import classifier.store.PredictionRecordRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = "classifier.auth.api-token=test-token")
@AutoConfigureMockMvc
class FeedbackApiTest {

  @Autowired MockMvc mvc;
  @Autowired ObjectMapper om;
  @Autowired FeedbackStore store;
  @Autowired PredictionRecordRepository repository;
  @MockBean Predictor predictor;

  @BeforeEach
  void setUp() {
    repository.deleteAll();
    when(predictor.isLoaded()).thenReturn(true);
  }

  @Test
  void catPredictionThenPositiveFeedbackGivesFullSatisfaction() throws Exception {
    when(predictor.predict(any())).thenReturn(ClassificationResult.of(0.97));

    var res = mvc.perform(multipart("/predict")
            .file(new MockMultipartFile("file", "tom.jpg", "image/jpeg", new byte[] {1, 2, 3}))
            .param("rgpd_consent", "true")
            .header("Authorization", "Bearer test-token"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.prediction").value("Cat"))
        .andReturn();
    long feedbackId = om.readTree(res.getResponse().getContentAsByteArray()).get("feedback_id").asLong();

    mvc.perform(post("/feedback")
            .param("feedback_id", String.valueOf(feedbackId))
            .param("user_feedback", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.feedback_id").value(feedbackId));

    mvc.perform(get("/statistics"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_predictions").value(1))
        .andExpect(jsonPath("$.satisfaction_rate_pct").value(100.0))
        .andExpect(jsonPath("$.success_rate_pct").value(100.0))
        .andExpect(jsonPath("$.predictions_by_class.cat").value(1))
        .andExpect(jsonPath("$.predictions_by_class.dog").value(0));
  }

  @Test
  void feedbackAndCommentAreStoredTogether() throws Exception {
    PredictionRecord record = store.save(PredictionAttempt.success("dog", 20.0, 80.0, 15, true, "rex.png"));

    mvc.perform(post("/feedback")
            .param("feedback_id", record.getId().toString())
            .param("user_feedback", "0")
            .param("user_comment", "that is clearly a cat"))
        .andExpect(status().isOk());

    PredictionRecord updated = store.find(record.getId()).orElseThrow();
    assertThat(updated.getUserFeedback()).contains(0);
    assertThat(updated.getUserComment()).contains("that is clearly a cat");
  }

  @Test
  void commentOnlyLeavesFeedbackUnset() throws Exception {
    PredictionRecord record = store.save(PredictionAttempt.success("cat", 70.0, 30.0, 15, true, "kitty.png"));

    mvc.perform(post("/feedback")
            .param("feedback_id", record.getId().toString())
            .param("user_comment", "blurry picture"))
        .andExpect(status().isOk());

    PredictionRecord updated = store.find(record.getId()).orElseThrow();
    assertThat(updated.getUserFeedback()).isEmpty();
    assertThat(updated.getUserComment()).contains("blurry picture");
  }

  @Test
  void recordWithoutConsentRejectsAnyAmendment() throws Exception {
    PredictionRecord record = store.save(PredictionAttempt.success("cat", 60.0, 40.0, 15, false, "secret.jpg"));

    mvc.perform(post("/feedback")
            .param("feedback_id", record.getId().toString())
            .param("user_feedback", "1")
            .param("user_comment", "nice"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.title").value("consent_denied"));

    mvc.perform(post("/feedback")
            .param("feedback_id", record.getId().toString())
            .param("user_comment", "comment only"))
        .andExpect(status().isForbidden());

    PredictionRecord unchanged = store.find(record.getId()).orElseThrow();
    assertThat(unchanged.getUserFeedback()).isEmpty();
    assertThat(unchanged.getUserComment()).isEmpty();
    assertThat(unchanged.getFilename()).isEmpty();
  }

  @Test
  void unknownIdReturns404() throws Exception {
    mvc.perform(post("/feedback")
            .param("feedback_id", "987654321")
            .param("user_feedback", "1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("not_found"))
        .andExpect(jsonPath("$.requestId").exists());
  }

  @Test
  void outOfRangeFeedbackIsRejected() throws Exception {
    PredictionRecord record = store.save(PredictionAttempt.success("cat", 60.0, 40.0, 15, true, "a.jpg"));

    mvc.perform(post("/feedback")
            .param("feedback_id", record.getId().toString())
            .param("user_feedback", "5"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("invalid_input"));

    mvc.perform(post("/feedback")
            .param("feedback_id", record.getId().toString())
            .param("user_feedback", "1")
            .param("user_comment", "x".repeat(2001)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("invalid_input"));

    PredictionRecord unchanged = store.find(record.getId()).orElseThrow();
    assertThat(unchanged.getUserFeedback()).isEmpty();
    assertThat(unchanged.getUserComment()).isEmpty();
  }

  @Test
  void consentIsCheckedBeforeThePayload() throws Exception {
    PredictionRecord record = store.save(PredictionAttempt.success("dog", 40.0, 60.0, 15, false, null));

    mvc.perform(post("/feedback")
            .param("feedback_id", record.getId().toString())
            .param("user_feedback", "5"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.title").value("consent_denied"));

    mvc.perform(post("/feedback")
            .param("feedback_id", record.getId().toString())
            .param("user_comment", "x".repeat(2001)))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.title").value("consent_denied"));
  }

  @Test
  void unknownIdIsReportedBeforeThePayload() throws Exception {
    mvc.perform(post("/feedback")
            .param("feedback_id", "987654321")
            .param("user_feedback", "5"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("not_found"));

    mvc.perform(post("/feedback")
            .param("feedback_id", "987654321")
            .param("user_comment", "x".repeat(2001)))
        .andExpect(status().isNotFound());
  }

  @Test
  void missingOrMalformedFeedbackIdIsRejected() throws Exception {
    mvc.perform(post("/feedback").param("user_feedback", "1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("bad_request"));

    mvc.perform(post("/feedback").param("feedback_id", "abc"))
        .andExpect(status().isBadRequest());
  }
}
