package classifier;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import classifier.predictor.ClassificationResult;
import classifier.predictor.Predictor;
import java.sql.SQLException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * The database is gone before any transaction can start.
 */
@SpringBootTest(properties = "classifier.auth.api-token=test-token")
@AutoConfigureMockMvc
class StoreOutageApiTest {

  @Autowired MockMvc mvc;
  @MockBean PlatformTransactionManager transactionManager;
  @MockBean Predictor predictor;

  @BeforeEach
  void databaseUnreachable() {
    when(predictor.isLoaded()).thenReturn(true);
    when(transactionManager.getTransaction(any())).thenThrow(new CannotCreateTransactionException(
        "Could not open JPA EntityManager for transaction",
        new SQLException("Connection to db.internal:5432 refused")));
  }

  @Test
  void predictionAnswersStoreFailure() throws Exception {
    when(predictor.predict(any())).thenReturn(ClassificationResult.of(0.8));

    mvc.perform(multipart("/predict")
            .file(new MockMultipartFile("file", "cat.jpg", "image/jpeg", new byte[] {1, 2, 3}))
            .param("rgpd_consent", "true")
            .header("Authorization", "Bearer test-token")
            .header("X-Request-Id", "outage-1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.title").value("store_failure"))
        .andExpect(jsonPath("$.requestId").value("outage-1"))
        .andExpect(jsonPath("$.detail").value(not(containsString("db.internal"))));
  }

  @Test
  void feedbackAnswersStoreFailure() throws Exception {
    mvc.perform(post("/feedback")
            .param("feedback_id", "1")
            .param("user_feedback", "1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.title").value("store_failure"))
        .andExpect(jsonPath("$.detail").value("Feedback store operation failed"));
  }
}
