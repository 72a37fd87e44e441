package com.Tkmind.recall_bridge.dto.request;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
@Data

public class BotCreateRequest {
    @NotNull(message = "Meeting ID is required")
    private Long meetingId;

    /** Minutes before the meeting start the bot should join. Defaults to recall.bot.default-join-minutes-before. */
    @Min(value = 0, message = "joinMinutesBefore must not be negative")
    @Max(value = 60, message = "joinMinutesBefore must be at most 60")
    private Integer joinMinutesBefore;
}
