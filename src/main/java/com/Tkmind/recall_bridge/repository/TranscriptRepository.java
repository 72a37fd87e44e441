package com.Tkmind.recall_bridge.repository;

import com.Tkmind.recall_bridge.entity.Transcript;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TranscriptRepository extends JpaRepository<Transcript, Long> {

    // meeting_id is unique, so at most one match
    Optional<Transcript> findByMeetingId(Long meetingId);

    boolean existsByMeetingId(Long meetingId);
}
