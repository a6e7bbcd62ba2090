package com.len.courtqueue.api.queue.dto;

import jakarta.validation.constraints.NotBlank;

public record LeaveQueueRequest(
        @NotBlank(message = "resourceId는 필수입니다.")
        String resourceId,

        @NotBlank(message = "userId는 필수입니다.")
        String userId
) {}
