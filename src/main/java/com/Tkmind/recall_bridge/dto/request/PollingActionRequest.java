package com.Tkmind.recall_bridge.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PollingActionRequest {

    /** start, stop or force-poll */
    @NotBlank(message = "action is required")
    private String action;
}
