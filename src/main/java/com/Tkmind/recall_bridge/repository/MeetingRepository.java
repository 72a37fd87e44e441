package com.Tkmind.recall_bridge.repository;

import com.Tkmind.recall_bridge.entity.Meeting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface MeetingRepository extends JpaRepository<Meeting, Long> {
    List<Meeting> findByUserIdOrderByStartTimeDesc(Long userId);

    // several meetings of one user may share a bot when they use the same link
    Optional<Meeting> findFirstByBotIdAndUserIdOrderByIdAsc(String botId, Long userId);

    boolean existsByBotId(String botId);

    // poller selection, stable order within a tick
    List<Meeting> findByBotIdIsNotNullAndStatusInOrderByIdAsc(Collection<Meeting.MeetingStatus> statuses);
}
