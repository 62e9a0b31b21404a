package com.ai.prescreening.service;

import com.ai.prescreening.dto.CallResult;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Posts the final call result to the backend. Delivery never blocks teardown.
 */
@Service
public class ResultWebhookService {

    private static final Logger log = LoggerFactory.getLogger(ResultWebhookService.class);

    static final String PATH = "/webhook/prescreening/call-result";
    static final String SECRET_HEADER = "X-Webhook-Secret";

    private final RestTemplate restTemplate;
    private final Executor backgroundExecutor;

    @Value("${webhook.backend-url:}")
    private String backendUrl;

    @Value("${webhook.secret:}")
    private String secret;

    public ResultWebhookService(RestTemplateBuilder builder,
                                @Qualifier("backgroundExecutor") Executor backgroundExecutor) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
        this.backgroundExecutor = backgroundExecutor;
    }

    public CompletableFuture<Void> deliver(CallResult result) {
        if (StringUtils.isBlank(backendUrl)) {
            log.warn("[{}] webhook.backend-url not set, result not sent (status={})",
                    result.getCallId(), result.getStatus().getWireValue());
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> post(result), backgroundExecutor);
    }

    void post(CallResult result) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(SECRET_HEADER, secret);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(backendUrl + PATH,
                    new HttpEntity<>(result, headers), String.class);
            log.info("[{}] Backend webhook response: {}", result.getCallId(), response.getStatusCode().value());
        } catch (RestClientException e) {
            log.error("[{}] Failed to POST results to backend: {}", result.getCallId(), e.getMessage());
        }
    }
}
