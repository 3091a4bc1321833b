package com.scorebook.gamestate.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scorebook.common.exception.ApiException;
import com.scorebook.common.model.AtBatEvent;
import com.scorebook.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * WebClient implementation of {@link ScorebookBackend}.
 *
 * <p>Every request carries {@code Authorization: Bearer <token>}. Non-2xx responses are
 * decoded from the backend's {@code {"error": ..., "errorType": ...}} body into an
 * {@link ApiException}; a 401 gets a fixed "session expired" message. Writes also carry
 * the {@code X-Mutation-Id} of the optimistic mutation that issued them.
 */
public class ScorebookApiClient implements ScorebookBackend {

    private static final Logger log = LoggerFactory.getLogger(ScorebookApiClient.class);

    static final String MUTATION_ID_HEADER = "X-Mutation-Id";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final AccessTokenSupplier tokens;

    public ScorebookApiClient(WebClient scorebookWebClient, ObjectMapper objectMapper, AccessTokenSupplier tokens) {
        this.webClient    = scorebookWebClient;
        this.objectMapper = objectMapper;
        this.tokens       = tokens;
    }

    @Override
    public Mono<List<AtBatEvent>> listAtBats(String gameId) {
        return tokens.token()
            .flatMap(jwt -> webClient.get()
                .uri("/games/{gameId}/atbats", gameId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + jwt)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toApiException)
                .bodyToFlux(AtBatEvent.class)
                .collectList())
            .doOnSuccess(list -> log.info("At-bats fetched. gameId={} count={}", gameId, list.size()))
            .doOnError(e -> log.warn("At-bat list failed. gameId={} err={}", gameId, e.toString()));
    }

    @Override
    public Mono<AtBatEvent> createAtBat(String gameId, CreateAtBatRequest request) {
        return traced("create", mutationId -> tokens.token()
            .flatMap(jwt -> webClient.post()
                .uri("/games/{gameId}/atbats", gameId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + jwt)
                .header(MUTATION_ID_HEADER, mutationId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toApiException)
                .bodyToMono(AtBatEvent.class))
            .doOnNext(ab -> TraceContextUtil.withMdc(mutationId, () ->
                log.info("At-bat created. gameId={} atBatId={} result={}", gameId, ab.atBatId(), ab.result()))));
    }

    @Override
    public Mono<AtBatEvent> updateAtBat(String gameId, String atBatId, UpdateAtBatRequest request) {
        return traced("update", mutationId -> tokens.token()
            .flatMap(jwt -> webClient.put()
                .uri("/games/{gameId}/atbats/{atBatId}", gameId, atBatId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + jwt)
                .header(MUTATION_ID_HEADER, mutationId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toApiException)
                .bodyToMono(AtBatEvent.class))
            .doOnNext(ab -> TraceContextUtil.withMdc(mutationId, () ->
                log.info("At-bat updated. gameId={} atBatId={}", gameId, atBatId))));
    }

    @Override
    public Mono<Void> deleteAtBat(String gameId, String atBatId) {
        return traced("delete", mutationId -> tokens.token()
            .flatMap(jwt -> webClient.delete()
                .uri("/games/{gameId}/atbats/{atBatId}", gameId, atBatId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + jwt)
                .header(MUTATION_ID_HEADER, mutationId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toApiException)
                .bodyToMono(Void.class))
            .doOnSuccess(v -> TraceContextUtil.withMdc(mutationId, () ->
                log.info("At-bat deleted. gameId={} atBatId={}", gameId, atBatId))));
    }

    @Override
    public Mono<GameResponse> getGame(String gameId) {
        return tokens.token()
            .flatMap(jwt -> webClient.get()
                .uri("/games/{gameId}", gameId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + jwt)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toApiException)
                .bodyToMono(GameResponse.class))
            .doOnNext(g -> log.info("Game fetched. gameId={} lineupSize={}",
                                       gameId, g.lineup() != null ? g.lineup().size() : 0));
    }

    /** Runs a write with the mutation id from the Reactor Context, logging failures under it. */
    private <T> Mono<T> traced(String action, Function<String, Mono<T>> call) {
        return Mono.deferContextual(ctx -> {
            String mutationId = TraceContextUtil.getMutationId(ctx);
            return call.apply(mutationId)
                .doOnError(e -> TraceContextUtil.withMdc(mutationId, () ->
                    log.warn("[ScorebookApi] {} failed. err={}", action, e.toString())));
        });
    }

    // ── error decoding ──────────────────────────────────────────────────────

    private Mono<? extends Throwable> toApiException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> decodeError(status, body));
    }

    ApiException decodeError(int status, String body) {
        if (status == 401) {
            return new ApiException(status, "Session expired. Please sign in again.", "Unauthorized");
        }
        String message = body.isBlank() ? "Unknown error" : body;
        String errorType = null;
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root != null && root.isObject()) {
                message   = root.path("error").asText("Unknown error");
                errorType = root.hasNonNull("errorType") ? root.get("errorType").asText() : null;
            }
        } catch (Exception e) {
            log.debug("Non-JSON error body. status={} body={}", status, body);
        }
        return new ApiException(status, message, errorType);
    }
}
