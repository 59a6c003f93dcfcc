package com.dbbaskette.codeguardian.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * The subject a review runs against. Registration and access checks happen outside this service.
 */
@Entity
@Table(name = "pull_requests", uniqueConstraints = @UniqueConstraint(columnNames = {"repo_owner", "repo_name", "pr_number"}))
public class PullRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "repo_owner", nullable = false)
    private String repoOwner;

    @Column(name = "repo_name", nullable = false)
    private String repoName;

    @Column(name = "pr_number", nullable = false)
    private int number;

    @Column(name = "title")
    private String title;

    @Lob
    @Column(name = "description")
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt = LocalDateTime.now();

    public PullRequest() {}

    public PullRequest(String repoOwner, String repoName, int number, String title) {
        this.repoOwner = repoOwner;
        this.repoName = repoName;
        this.number = number;
        this.title = title;
    }

    public String fullName() {
        return repoOwner + "/" + repoName;
    }

    // Getters and setters

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getRepoOwner() { return repoOwner; }
    public void setRepoOwner(String repoOwner) { this.repoOwner = repoOwner; }

    public String getRepoName() { return repoName; }
    public void setRepoName(String repoName) { this.repoName = repoName; }

    public int getNumber() { return number; }
    public void setNumber(int number) { this.number = number; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public LocalDateTime getCreatedAt() { return createdAt; }
}
