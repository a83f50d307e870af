package classifier.store;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface PredictionRecordRepository extends JpaRepository<PredictionRecord, Long> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select p from PredictionRecord p where p.id = :id")
  Optional<PredictionRecord> findByIdForUpdate(@Param("id") Long id);

  List<PredictionRecord> findAllByOrderByTimestampDescIdDesc(Pageable pageable);

  long countBySuccessTrue();

  long countByUserFeedback(Integer userFeedback);

  long countByUserFeedbackIsNotNull();

  @Query("select avg(p.inferenceTimeMs) from PredictionRecord p")
  Double averageInferenceTimeMs();

  @Query("select p.predictionResult as label, count(p) as total from PredictionRecord p"
      + " where p.success = true group by p.predictionResult")
  List<ClassCount> countSuccessfulByClass();

  interface ClassCount {
    String getLabel();

    Long getTotal();
  }
}
