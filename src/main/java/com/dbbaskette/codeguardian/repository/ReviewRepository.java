package com.dbbaskette.codeguardian.repository;

import com.dbbaskette.codeguardian.model.Review;
import com.dbbaskette.codeguardian.model.ReviewStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import java.time.LocalDateTime;
import java.util.List;

public interface ReviewRepository extends JpaRepository<Review, Long> {

    boolean existsByActivePullRequestId(Long pullRequestId);

    long countByStatusIn(List<ReviewStatus> statuses);

    List<Review> findByCreatedAtGreaterThanEqual(LocalDateTime since);

    @Query("SELECT r FROM Review r WHERE (:status IS NULL OR r.status = :status) "
            + "AND (:pullRequestId IS NULL OR r.pullRequest.id = :pullRequestId) "
            + "ORDER BY r.createdAt DESC, r.id DESC")
    List<Review> search(ReviewStatus status, Long pullRequestId, Pageable pageable);

    @Query("SELECT COUNT(r) FROM Review r WHERE (:status IS NULL OR r.status = :status) "
            + "AND (:pullRequestId IS NULL OR r.pullRequest.id = :pullRequestId)")
    long countMatching(ReviewStatus status, Long pullRequestId);
}
