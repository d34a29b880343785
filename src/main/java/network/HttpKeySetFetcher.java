package network;

import config.SystemConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Fetches the key set from the provider certificate endpoint over HTTPS.
 * The {@link HttpClient} is always supplied by the caller.
 */
public class HttpKeySetFetcher implements KeySetFetcher {
    private final HttpClient http;
    private final URI certsUri;

    public HttpKeySetFetcher(HttpClient http, URI certsUri) {
        this.http = Objects.requireNonNull(http);
        this.certsUri = Objects.requireNonNull(certsUri);
    }

    /**
     * A fetcher for Google's certificate endpoint with the configured connect timeout.
     */
    public static HttpKeySetFetcher forGoogle() {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(SystemConfig.CONNECTION_TIMEOUT_MS))
                .build();
        return new HttpKeySetFetcher(client, URI.create(SystemConfig.GOOGLE_CERTS_URL));
    }

    @Override
    public byte[] fetch() throws IOException {
        HttpRequest req = HttpRequest.newBuilder(certsUri)
                .timeout(Duration.ofMillis(SystemConfig.REQUEST_TIMEOUT_MS))
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<byte[]> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching key set from " + certsUri, e);
        }
        if (resp.statusCode() != 200) {
            throw new IOException("Key set fetch failed: " + resp.statusCode() + " from " + certsUri);
        }
        return resp.body();
    }

    public URI getCertsUri() {
        return certsUri;
    }
}
