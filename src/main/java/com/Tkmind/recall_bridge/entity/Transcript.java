package com.Tkmind.recall_bridge.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "transcripts")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transcript {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // unique: at most one transcript per meeting, written once and never updated
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "meeting_id", nullable = false, unique = true, updatable = false)
    private Meeting meeting;

    @Column(name = "bot_id", updatable = false)
    private String botId;

    @Column(columnDefinition = "LONGTEXT", nullable = false, updatable = false)
    private String content;

    @Column(columnDefinition = "TEXT")
    private String summary;

    /** JSON array of {id, name} speakers. */
    @Column(columnDefinition = "TEXT", updatable = false)
    private String attendees;

    /** Minutes, from the end time of the last word. */
    @Column(updatable = false)
    private Integer duration;

    @Column(name = "processed_at", updatable = false)
    private LocalDateTime processedAt;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
