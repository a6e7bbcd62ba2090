package com.len.courtqueue.api.queue;

import com.len.courtqueue.api.queue.dto.AllQueuesResponse;
import com.len.courtqueue.api.queue.dto.EnterQueueRequest;
import com.len.courtqueue.api.queue.dto.LeaveQueueRequest;
import com.len.courtqueue.api.queue.dto.QueueActionResponse;
import com.len.courtqueue.api.queue.dto.QueueStatusResponse;
import com.len.courtqueue.application.queue.QueueCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/queues")
public class QueueController {

    private final QueueCoordinator queueCoordinator;

    // 전체 대기열
    @GetMapping
    public AllQueuesResponse getAllQueues() {
        var queues = queueCoordinator.listAll().stream()
                .map(QueueStatusResponse::from)
                .toList();
        return new AllQueuesResponse(queues);
    }

    // 코트별 상태 (대기열이 없어도 빈 상태로 응답)
    @GetMapping("/{id}")
    public QueueStatusResponse getQueueStatusForCourt(@PathVariable String id) {
        return QueueStatusResponse.from(queueCoordinator.status(id));
    }

    // 대기열 진입
    @PostMapping("/enter")
    public QueueActionResponse enterCourtQueue(@Valid @RequestBody EnterQueueRequest request) {
        var result = queueCoordinator.join(
                request.resourceId(),
                request.userId(),
                request.userName(),
                request.teamId()
        );
        return QueueActionResponse.from(result);
    }

    // 대기열 이탈
    @PostMapping("/leave")
    public QueueActionResponse leaveCourtQueue(@Valid @RequestBody LeaveQueueRequest request) {
        var result = queueCoordinator.leave(request.resourceId(), request.userId());
        return QueueActionResponse.from(result);
    }
}
