package com.ai.prescreening.service;

import com.ai.prescreening.conversation.ChatMessage;
import com.ai.prescreening.conversation.SessionState;
import com.ai.prescreening.dto.CallResult;
import com.ai.prescreening.support.CallFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ResultWebhookServiceTest {

    private MockRestServiceServer server;
    private ResultWebhookService service;
    private CallResult result;

    @BeforeEach
    void setUp() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        service = new ResultWebhookService(new RestTemplateBuilder(customizer), Runnable::run);
        server = customizer.getServer();

        SessionState state = new SessionState(CallFixture.input().build(), "nl");
        state.setSchedulingPreference("liefst in de voormiddag");
        result = CallResult.from(state, List.of(new ChatMessage("user", "ja")), null);
    }

    @Test
    void postsTheResultWithTheSharedSecret() {
        ReflectionTestUtils.setField(service, "backendUrl", "http://backend.test");
        ReflectionTestUtils.setField(service, "secret", "s3cret");
        server.expect(requestTo("http://backend.test" + ResultWebhookService.PATH))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(ResultWebhookService.SECRET_HEADER, "s3cret"))
                .andExpect(jsonPath("$.call_id").value("call-1"))
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.transcript[0].message").value("ja"))
                .andRespond(withSuccess());

        service.deliver(result).join();

        server.verify();
    }

    @Test
    void backendErrorsAreLoggedNotThrown() {
        ReflectionTestUtils.setField(service, "backendUrl", "http://backend.test");
        server.expect(requestTo("http://backend.test" + ResultWebhookService.PATH)).andRespond(withServerError());

        assertThat(service.deliver(result)).succeedsWithin(java.time.Duration.ofSeconds(1));
        server.verify();
    }

    @Test
    void missingBackendUrlSkipsDelivery() {
        assertThat(service.deliver(result)).isCompleted();

        server.verify();
    }
}
