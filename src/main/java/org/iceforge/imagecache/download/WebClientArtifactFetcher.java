package org.iceforge.imagecache.download;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Streams artifact bodies over HTTP(S).
 * <p>
 * Presigned URLs are passed to the client as a {@link URI} so the already-encoded signature is
 * sent untouched.
 */
public class WebClientArtifactFetcher implements ArtifactFetcher {

    private final WebClient webClient;
    private final Duration idleTimeout;

    public WebClientArtifactFetcher(WebClient.Builder builder, Duration idleTimeout) {
        this.idleTimeout = Objects.requireNonNull(idleTimeout);
        HttpClient httpClient = HttpClient.create().compress(true).followRedirect(true);
        this.webClient = builder.clientConnector(new ReactorClientHttpConnector(httpClient)).build();
    }

    @Override
    public Stream<byte[]> open(String sourceUrl) {
        URI uri;
        try {
            uri = new URI(sourceUrl);
        } catch (URISyntaxException e) {
            throw new ArtifactFetchException("Malformed source url: " + e.getMessage(), e);
        }
        String target = describe(uri);
        return webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToFlux(DataBuffer.class)
                .doOnDiscard(DataBuffer.class, DataBufferUtils::release)
                .timeout(idleTimeout)
                .map(WebClientArtifactFetcher::drain)
                .onErrorMap(e -> !(e instanceof ArtifactFetchException),
                        e -> new ArtifactFetchException("GET " + target + " failed: " + reason(e), e))
                .toStream(1);
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    // WebClientResponseException messages embed the full request URI.
    private static String reason(Throwable e) {
        if (e instanceof WebClientResponseException r) {
            return r.getStatusCode().value() + " " + r.getStatusText();
        }
        if (e instanceof TimeoutException) {
            return "no data received within the idle timeout";
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    /** Scheme, host and path only; the query string holds credentials. */
    static String describe(URI uri) {
        String host = uri.getHost() == null ? "" : uri.getHost();
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        return uri.getScheme() + "://" + host + path;
    }
}
