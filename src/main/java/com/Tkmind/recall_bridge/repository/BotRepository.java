package com.Tkmind.recall_bridge.repository;

import com.Tkmind.recall_bridge.entity.Bot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BotRepository extends JpaRepository<Bot, String> {
    // the reusable bot for a link, retired bots are skipped
    Optional<Bot> findByUserIdAndActiveMeetingUrl(Long userId, String meetingUrl);
}
