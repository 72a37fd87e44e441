package com.Tkmind.recall_bridge.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "meetings")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Meeting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    /** zoom, meet or teams, derived from the meeting URL. */
    @Column(length = 50)
    private String platform;

    @Column(name = "meeting_url", length = 1000)
    private String meetingUrl;

    /**
     * Recall.ai bot currently linked to this meeting. At most one at a time;
     * cleared only by removing bot tracking.
     */
    @Column(name = "bot_id")
    private String botId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 50)
    @Builder.Default
    private MeetingStatus status = MeetingStatus.SCHEDULED;

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

    public enum MeetingStatus {
        SCHEDULED, IN_PROGRESS, COMPLETED, ERROR;

        /**
         * Forward-only lifecycle. Going back to SCHEDULED happens only when bot
         * tracking is removed, which bypasses this check.
         */
        public boolean canTransitionTo(MeetingStatus next) {
            return switch (this) {
                case SCHEDULED -> next != SCHEDULED;
                case IN_PROGRESS -> next == COMPLETED || next == ERROR;
                case COMPLETED, ERROR -> false;
            };
        }
    }
}
