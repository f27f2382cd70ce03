package com.flamingo.ndthub.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Bearer token issued at login, with the activity of the session it represents. */
@Entity
@Table(name = "session_tokens")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionToken {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "user_id", nullable = false)
  private User user;

  @Column(nullable = false, unique = true)
  private String token;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime lastSeenAt;

  private String lastPath;

  @Column(length = 64)
  private String ip;

  @Column(length = 512)
  private String userAgent;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    if (lastSeenAt == null) {
      lastSeenAt = now;
    }
  }

  /** Records a request made with this token. */
  public void touch(String path) {
    this.lastSeenAt = LocalDateTime.now();
    this.lastPath = path;
  }

  /** Seconds between login and the last request seen with this token. */
  public long activeSeconds() {
    if (createdAt == null || lastSeenAt == null) {
      return 0;
    }
    return Math.max(0, Duration.between(createdAt, lastSeenAt).getSeconds());
  }
}
