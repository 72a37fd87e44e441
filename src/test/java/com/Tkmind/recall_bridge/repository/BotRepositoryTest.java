package com.Tkmind.recall_bridge.repository;

import com.Tkmind.recall_bridge.entity.Bot;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
class BotRepositoryTest {

    private static final String URL = "https://meet.google.com/abc-defg-hij";

    @Autowired
    private BotRepository botRepository;

    private static Bot bot(String id, Long userId, String url) {
        return Bot.builder().id(id).userId(userId).meetingUrl(url).activeMeetingUrl(url)
                .status("ready").platform("meet").build();
    }

    @Test
    void secondBotForSameUserAndLinkTriggersUniqueViolation() {
        botRepository.saveAndFlush(bot("bot-1", 1L, URL));

        assertThrows(DataIntegrityViolationException.class,
                () -> botRepository.saveAndFlush(bot("bot-2", 1L, URL)));
    }

    @Test
    void sameLinkForAnotherUserIsAllowed() {
        botRepository.saveAndFlush(bot("bot-1", 1L, URL));
        botRepository.saveAndFlush(bot("bot-2", 2L, URL));

        assertThat(botRepository.findByUserIdAndActiveMeetingUrl(2L, URL))
                .get().extracting(Bot::getId).isEqualTo("bot-2");
    }

    @Test
    void retiredBotsKeepTheirRowAndFreeTheLink() {
        Bot first = botRepository.saveAndFlush(bot("bot-1", 1L, URL));
        first.setActiveMeetingUrl(null);
        botRepository.saveAndFlush(first);
        Bot second = botRepository.saveAndFlush(bot("bot-2", 1L, URL));
        second.setActiveMeetingUrl(null);
        botRepository.saveAndFlush(second);
        botRepository.saveAndFlush(bot("bot-3", 1L, URL));

        assertThat(botRepository.findAll()).extracting(Bot::getId)
                .containsExactlyInAnyOrder("bot-1", "bot-2", "bot-3");
        assertThat(botRepository.findById("bot-1").orElseThrow().getMeetingUrl()).isEqualTo(URL);
        assertThat(botRepository.findByUserIdAndActiveMeetingUrl(1L, URL))
                .get().extracting(Bot::getId).isEqualTo("bot-3");
    }

    @Test
    void timestampsAreSetOnInsert() {
        Bot saved = botRepository.saveAndFlush(bot("bot-1", 1L, URL));

        assertThat(saved.getCreatedAt()).isNotNull();
        assertThat(saved.getUpdatedAt()).isNotNull();
    }
}
