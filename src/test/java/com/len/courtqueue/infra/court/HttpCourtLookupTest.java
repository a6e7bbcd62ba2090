package com.len.courtqueue.infra.court;

import com.len.courtqueue.domain.court.CourtLookup.CourtInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.http.HttpMethod.GET;

class HttpCourtLookupTest {

    private static final String BASE_URL = "http://court-service";

    MockRestServiceServer server;
    HttpCourtLookup lookup;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        lookup = new HttpCourtLookup(builder.build());
    }

    @Test
    @DisplayName("success=true 응답이면 코트 이름을 돌려준다")
    void find_success() {
        server.expect(requestTo(BASE_URL + "/api/courts/court-1"))
                .andExpect(method(GET))
                .andRespond(withSuccess("""
                        {"success":true,"data":{"id":"court-1","name":"Center Court","surface":"clay"}}
                        """, MediaType.APPLICATION_JSON));

        assertThat(lookup.find("court-1")).contains(new CourtInfo("court-1", "Center Court"));
        server.verify();
    }

    @Test
    @DisplayName("404 는 코트 없음")
    void find_notFound() {
        server.expect(requestTo(BASE_URL + "/api/courts/nope"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(lookup.find("nope")).isEmpty();
    }

    @Test
    @DisplayName("코트 서비스 장애도 코트 없음으로 본다")
    void find_serverError() {
        server.expect(requestTo(BASE_URL + "/api/courts/court-1"))
                .andRespond(withServerError());

        assertThat(lookup.find("court-1")).isEmpty();
    }

    @Test
    @DisplayName("success=false 응답은 코트 없음")
    void find_unsuccessfulBody() {
        server.expect(requestTo(BASE_URL + "/api/courts/court-1"))
                .andRespond(withSuccess("{\"success\":false,\"message\":\"Court not found\"}", MediaType.APPLICATION_JSON));

        assertThat(lookup.find("court-1")).isEmpty();
    }
}
