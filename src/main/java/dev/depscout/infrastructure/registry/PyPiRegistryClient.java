package dev.depscout.infrastructure.registry;

import com.fasterxml.jackson.databind.JsonNode;
import dev.depscout.config.RegistryProperties;
import dev.depscout.domain.valueobject.PackageMetadata;
import dev.depscout.domain.valueobject.PackageMetadata.ReleaseVersion;
import dev.depscout.exception.PackageLookupException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PyPI JSON API client with circuit breaker and rate limiting.
 *
 * <p>A 404 is an answer, not a failure: it yields {@link Optional#empty()} and does not count
 * against the circuit breaker. Every other problem surfaces as {@link PackageLookupException}.
 */
@Component
public class PyPiRegistryClient {

    private static final Logger log = LoggerFactory.getLogger(PyPiRegistryClient.class);

    static final int MAX_RELEASES = 20;

    private final WebClient webClient;

    public PyPiRegistryClient(WebClient.Builder builder, RegistryProperties props) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(props.responseTimeout())
                .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000);
        this.webClient = builder.baseUrl(props.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, props.userAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    @CircuitBreaker(name = "pypi")
    @RateLimiter(name = "pypi")
    public Optional<PackageMetadata> fetch(String packageName) {
        JsonNode body;
        try {
            body = webClient.get()
                    .uri("/pypi/{name}/json", packageName)
                    .exchangeToMono(response -> {
                        if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            return response.releaseBody().then(Mono.<JsonNode>empty());
                        }
                        if (response.statusCode().isError()) {
                            return response.createException().flatMap(Mono::error);
                        }
                        return response.bodyToMono(JsonNode.class);
                    })
                    .block();
        } catch (RuntimeException e) {
            throw new PackageLookupException(packageName, e.getMessage(), e);
        }

        if (body == null) {
            log.info("Package {} not found on PyPI", packageName);
            return Optional.empty();
        }
        JsonNode info = body.path("info");
        if (info.isMissingNode()) {
            throw new PackageLookupException(packageName, "Invalid package data received from PyPI", null);
        }
        return Optional.of(toMetadata(packageName, info, body.path("releases")));
    }

    private static PackageMetadata toMetadata(String requestedName, JsonNode info, JsonNode releases) {
        String name = textOrNull(info, "name");
        return new PackageMetadata(
                name != null ? name : requestedName,
                textOrNull(info, "summary"),
                textOrNull(info, "author"),
                textOrNull(info, "license"),
                textOrNull(info, "version"),
                textOrNull(info, "requires_python"),
                recentReleases(releases),
                "https://pypi.org/project/%s/".formatted(requestedName),
                PackageMetadata.SOURCE_PYPI);
    }

    /** Releases that have at least one uploaded file, newest upload first. */
    static List<ReleaseVersion> recentReleases(JsonNode releases) {
        List<ReleaseVersion> versions = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = releases.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> release = fields.next();
            JsonNode files = release.getValue();
            if (!files.isArray() || files.isEmpty()) continue;
            JsonNode first = files.get(0);
            versions.add(new ReleaseVersion(
                    release.getKey(),
                    textOrNull(first, "upload_time"),
                    first.path("yanked").asBoolean(false),
                    textOrNull(first, "yanked_reason")));
        }
        return versions.stream()
                .sorted(Comparator.comparing(ReleaseVersion::uploadTime,
                        Comparator.nullsLast(Comparator.<String>reverseOrder())))
                .limit(MAX_RELEASES)
                .toList();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
