package com.Tkmind.recall_bridge.dto.recall;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Bot as returned by GET /bot/{id}. Only the fields the poller reads are mapped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecallBot {

    private String id;

    @JsonProperty("meeting_url")
    private Object meetingUrl;

    private String status;

    @JsonProperty("status_changes")
    @Builder.Default
    private List<StatusChange> statusChanges = new ArrayList<>();

    @Builder.Default
    private List<RecallRecording> recordings = new ArrayList<>();

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;

    /**
     * Latest status_changes code when the history is present, the top-level
     * status otherwise. The history is updated before the top-level field.
     */
    public String effectiveStatus() {
        if (statusChanges != null && !statusChanges.isEmpty()) {
            StatusChange latest = statusChanges.get(statusChanges.size() - 1);
            if (latest != null && latest.getCode() != null && !latest.getCode().isBlank()) {
                return latest.getCode();
            }
        }
        return status;
    }

    public boolean hasRecordings() {
        return recordings != null && !recordings.isEmpty();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StatusChange {
        private String code;
        private String message;

        @JsonProperty("created_at")
        private String createdAt;
    }
}
