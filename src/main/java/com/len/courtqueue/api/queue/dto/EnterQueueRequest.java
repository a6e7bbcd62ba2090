package com.len.courtqueue.api.queue.dto;

import jakarta.validation.constraints.NotBlank;

public record EnterQueueRequest(
        @NotBlank(message = "resourceId는 필수입니다.")
        String resourceId,

        @NotBlank(message = "userId는 필수입니다.")
        String userId,

        @NotBlank(message = "userName은 필수입니다.")
        String userName,

        String teamId         // 선택
) {}
