package com.len.courtqueue.domain.court;

import java.util.Optional;

public interface CourtLookup {

    /**
     * 코트 서비스에 존재 여부와 이름을 묻는다.
     * 코트가 없거나 코트 서비스 호출이 실패하면 empty.
     */
    Optional<CourtInfo> find(String courtId);

    record CourtInfo(String id, String name) {}
}
