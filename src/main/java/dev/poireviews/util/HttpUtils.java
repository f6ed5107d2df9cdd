package dev.poireviews.util;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/** Utility class for HTTP operations */
public class HttpUtils {

	public static final String USER_AGENT =
			"Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;
	private final Duration timeout;

	public HttpUtils() {
		this(DEFAULT_TIMEOUT);
	}

	public HttpUtils(Duration timeout) {
		this.timeout = timeout;
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(timeout)
				.build();
	}

	/**
	 * Send a JSON body with POST. The response is returned whatever its status code, so callers can
	 * classify it themselves.
	 */
	public HttpResponse<String> postJson(String url, String json, Map<String, String> headers)
			throws IOException, InterruptedException {
		HttpRequest request = request(url, headers)
				.header("Content-Type", "application/json")
				.POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
				.build();
		return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
	}

	/** Download content from a URL as a string */
	public String downloadString(String url, Map<String, String> headers) throws IOException, InterruptedException {
		HttpRequest request = request(url, headers).GET().build();
		HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		if (!isSuccess(response.statusCode())) {
			throw new IOException("Failed to download content: " + url + " - HTTP status: " + response.statusCode());
		}
		return response.body();
	}

	public static boolean isSuccess(int statusCode) {
		return statusCode >= 200 && statusCode < 300;
	}

	private HttpRequest.Builder request(String url, Map<String, String> headers) {
		HttpRequest.Builder builder =
				HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout);
		// java.net.http manages these itself and rejects them as restricted
		headers.forEach((name, value) -> {
			if (!name.equalsIgnoreCase("Connection") && !name.equalsIgnoreCase("Host")) {
				builder.header(name, value);
			}
		});
		return builder;
	}
}
