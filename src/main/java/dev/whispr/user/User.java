package dev.whispr.user;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * Public face of a platform account: the anonymous handle and echo points.
 *
 * <p>Maps a subset of the {@code users} table. Credentials, moderation state and everything else
 * stay with the account service and are deliberately not mapped here.
 */
@Entity
@Immutable
@Table(name = "users")
public class User {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, unique = true, length = 50)
  private String username;

  private int echoes;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected User() {
    // JPA requires no-arg constructor
  }

  public User(String username) {
    this.username = username;
  }

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public UUID getId() {
    return id;
  }

  public String getUsername() {
    return username;
  }

  public int getEchoes() {
    return echoes;
  }

  public void setEchoes(int echoes) {
    this.echoes = echoes;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
