package com.dbbaskette.codeguardian.repository;

import com.dbbaskette.codeguardian.model.ReviewComment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ReviewCommentRepository extends JpaRepository<ReviewComment, Long> {

    List<ReviewComment> findByReviewIdOrderByPositionAsc(Long reviewId);

    Optional<ReviewComment> findByIdAndReviewId(Long id, Long reviewId);

    @Query("SELECT c.severity, COUNT(c) FROM ReviewComment c WHERE c.reviewId IN :reviewIds GROUP BY c.severity")
    List<Object[]> countBySeverity(Collection<Long> reviewIds);
}
