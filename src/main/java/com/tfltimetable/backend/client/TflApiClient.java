package com.tfltimetable.backend.client;

import com.tfltimetable.backend.config.TflProperties;
import com.tfltimetable.backend.exception.UpstreamUnavailableException;
import com.tfltimetable.backend.model.tfl.SearchResponse;
import com.tfltimetable.backend.model.tfl.StopPoint;
import com.tfltimetable.backend.model.tfl.TimetableResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Component
@Slf4j
public class TflApiClient implements TflApi {

        private final WebClient webClient;
        private final Duration timeout;

        public TflApiClient(WebClient.Builder webClientBuilder, TflProperties properties) {
                this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
                if (!properties.hasAppKey()) {
                        log.warn("⚠️ No TfL app key configured, requests will be sent anonymously");
                }
                this.webClient = webClientBuilder
                                .baseUrl(properties.getBaseUrl())
                                .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
                                .filter(appKeyFilter(properties))
                                .codecs(configurer -> configurer
                                                .defaultCodecs()
                                                .maxInMemorySize(8 * 1024 * 1024)) // timetables are large
                                .build();
        }

        private static ExchangeFilterFunction appKeyFilter(TflProperties properties) {
                return (request, next) -> {
                        if (!properties.hasAppKey()) {
                                return next.exchange(request);
                        }
                        ClientRequest authenticated = ClientRequest.from(request)
                                        .url(UriComponentsBuilder.fromUri(request.url())
                                                        .queryParam("app_key", properties.getAppKey())
                                                        .build(true)
                                                        .toUri())
                                        .build();
                        return next.exchange(authenticated);
                };
        }

        @Override
        public SearchResponse searchStopPoints(String query, String mode) {
                log.debug("🔍 Searching stop points for '{}' (mode: {})", query, mode);
                return execute("stop point search for '" + query + "'", () -> webClient.get()
                                .uri(uriBuilder -> uriBuilder
                                                .path("/StopPoint/Search/{query}")
                                                .queryParam("modes", mode)
                                                .queryParam("includeHubs", false)
                                                .build(query))
                                .retrieve()
                                .bodyToMono(SearchResponse.class)
                                .timeout(timeout, timeoutError("stop point search"))
                                .block());
        }

        @Override
        public List<StopPoint> getStopPoints(List<String> ids) {
                String joined = String.join(",", ids);
                log.debug("📥 Fetching stop points: {}", joined);
                // one variable per id: ids are encoded, the separating commas are not
                String template = IntStream.range(0, ids.size())
                                .mapToObj(i -> "{id" + i + "}")
                                .collect(Collectors.joining(",", "/StopPoint/", ""));
                return execute("stop point details for " + joined, () -> webClient.get()
                                .uri(template, ids.toArray())
                                .retrieve()
                                .bodyToMono(new ParameterizedTypeReference<List<StopPoint>>() {
                                })
                                .timeout(timeout, timeoutError("stop point details"))
                                .block());
        }

        @Override
        public TimetableResponse getTimetable(String lineId, String fromStopPointId, String toStopPointId,
                        MultiValueMap<String, String> extraParams) {
                MultiValueMap<String, String> params = extraParams != null ? extraParams : new LinkedMultiValueMap<>();
                log.debug("🚇 Fetching timetable for line {} from {} to {} {}", lineId, fromStopPointId,
                                toStopPointId, params);

                Map<String, Object> variables = new HashMap<>();
                variables.put("lineId", lineId);
                variables.put("from", fromStopPointId);
                variables.put("to", toStopPointId);
                String path = toStopPointId == null
                                ? "/Line/{lineId}/Timetable/{from}"
                                : "/Line/{lineId}/Timetable/{from}/to/{to}";

                return execute("timetable for line " + lineId + " from " + fromStopPointId, () -> webClient.get()
                                .uri(uriBuilder -> {
                                        uriBuilder.path(path);
                                        // values go in as variables so they are encoded exactly once
                                        int index = 0;
                                        for (Map.Entry<String, List<String>> param : params.entrySet()) {
                                                for (String value : param.getValue()) {
                                                        String name = "q" + index++;
                                                        uriBuilder.queryParam(param.getKey(), "{" + name + "}");
                                                        variables.put(name, value);
                                                }
                                        }
                                        return uriBuilder.build(variables);
                                })
                                .retrieve()
                                .bodyToMono(TimetableResponse.class)
                                .timeout(timeout, timeoutError("timetable"))
                                .block());
        }

        private <T> Mono<T> timeoutError(String operation) {
                return Mono.error(() -> new UpstreamUnavailableException(
                                "TfL " + operation + " timed out after " + timeout.getSeconds() + "s"));
        }

        private <T> T execute(String description, Supplier<T> call) {
                try {
                        return call.get();
                } catch (WebClientResponseException e) {
                        log.error("❌ TfL returned {} for {}", e.getStatusCode().value(), description);
                        throw new UpstreamUnavailableException(
                                        "TfL returned " + e.getStatusCode().value() + " for " + description, e);
                } catch (WebClientException e) {
                        log.error("❌ TfL request failed for {}: {}", description, e.getMessage());
                        throw new UpstreamUnavailableException("TfL request failed for " + description, e);
                } catch (CodecException e) {
                        log.error("❌ Unexpected TfL payload for {}: {}", description, e.getMessage());
                        throw new UpstreamUnavailableException("Unexpected TfL payload for " + description, e);
                }
        }
}
