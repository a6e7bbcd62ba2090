package com.len.courtqueue.infra.court;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.len.courtqueue.domain.court.CourtLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

/**
 * 코트 서비스 GET /api/courts/{id} 호출.
 * 응답 형식: { "success": true, "data": { "id": "...", "name": "...", ... } }
 *
 * 404든 네트워크 오류든 호출자 입장에선 "코트 없음"과 같다.
 */
@Slf4j
@Component
public class HttpCourtLookup implements CourtLookup {

    private final RestClient restClient;

    public HttpCourtLookup(@Qualifier("courtServiceRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public Optional<CourtInfo> find(String courtId) {
        try {
            CourtDetailsResponse body = restClient.get()
                    .uri("/api/courts/{id}", courtId)
                    .retrieve()
                    .body(CourtDetailsResponse.class);

            if (body == null || !body.success() || body.data() == null || body.data().name() == null) {
                return Optional.empty();
            }

            String id = body.data().id() != null ? body.data().id() : courtId;
            return Optional.of(new CourtInfo(id, body.data().name()));

        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        } catch (RestClientException e) {
            log.warn("[COURT_LOOKUP_FAILED] courtId={} - {}", courtId, e.getMessage());
            return Optional.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CourtDetailsResponse(boolean success, CourtData data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CourtData(String id, String name) {}
}
