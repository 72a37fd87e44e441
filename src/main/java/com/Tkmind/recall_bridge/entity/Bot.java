package com.Tkmind.recall_bridge.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Local record of a Recall.ai bot. Rows are never deleted in normal flow:
 * meetings keep pointing at their bot after it finishes.
 *
 * <p>At most one bot per (owner, cleaned meeting URL) is reusable. That bot
 * carries the URL in {@code active_meeting_url}; a finished or vanished bot has
 * it cleared. The unique key on that column keeps concurrent bot creation from
 * producing two reusable bots for the same link.
 */
@Entity
@Table(name = "bots",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_bots_user_active_meeting_url",
                columnNames = {"user_id", "active_meeting_url"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Bot {

    /** Recall.ai bot id. */
    @Id
    @Column(length = 100)
    private String id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "meeting_url", nullable = false, length = 700)
    private String meetingUrl;

    /** Same as meetingUrl while the bot may be reused, null once retired. */
    @Column(name = "active_meeting_url", length = 700)
    private String activeMeetingUrl;

    @Column(name = "bot_name", length = 600)
    private String botName;

    /** Last effective status seen on Recall.ai. */
    @Column(length = 50)
    private String status;

    @Column(length = 20)
    private String platform;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
