package com.dbbaskette.codeguardian.repository;

import com.dbbaskette.codeguardian.model.PullRequest;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PullRequestRepository extends JpaRepository<PullRequest, Long> {
}
