package com.len.courtqueue.api.queue.dto;

import java.util.List;

public record AllQueuesResponse(List<QueueStatusResponse> queues) {}
