package dev.poireviews;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class FetchCommandTest {

	@TempDir
	Path tempDir;

	private HttpServer server;
	private final AtomicInteger requests = new AtomicInteger();
	private volatile int reviewPages = 2;

	@BeforeEach
	void setUp() throws IOException {
		ObjectMapper objectMapper = new ObjectMapper();
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/comments", exchange -> {
			requests.incrementAndGet();
			int page = objectMapper
					.readTree(exchange.getRequestBody())
					.at("/arg/pageIndex")
					.asInt();
			StringBuilder items = new StringBuilder();
			if (page <= reviewPages) {
				for (int i = 1; i <= 3; i++) {
					if (i > 1) items.append(',');
					int id = page * 10 + i;
					items.append("{\"commentId\": %d, \"score\": 5, \"usefulCount\": 1, \"content\": \"好评 %d\"}"
							.formatted(id, id));
				}
			}
			byte[] body = "{\"result\": {\"totalCount\": %d, \"items\": [%s]}}"
					.formatted(reviewPages * 3, items)
					.getBytes(StandardCharsets.UTF_8);
			exchange.sendResponseHeaders(200, body.length);
			try (OutputStream out = exchange.getResponseBody()) {
				out.write(body);
			}
		});
		server.start();
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
	}

	private int run(String... extra) {
		return runFor("25506", "0", "0", extra);
	}

	private int runFor(String poiId, String minDelay, String maxDelay, String... extra) {
		String apiUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/comments";
		List<String> args = new ArrayList<>(List.of(
				"fetch", "--poi-id", poiId, "--api-url", apiUrl, "--min-delay", minDelay, "--max-delay", maxDelay));
		args.addAll(List.of(extra));
		return new CommandLine(new Main()).execute(args.toArray(String[]::new));
	}

	@Test
	void testFetchWritesCsv() throws Exception {
		// Given
		Path output = tempDir.resolve("reviews.csv");

		// When
		int exitCode = run("--output", output.toString());

		// Then
		assertThat(exitCode).isZero();
		assertThat(requests.get()).isEqualTo(3);
		List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
		assertThat(lines).hasSize(7);
		assertThat(lines.get(1)).contains("好评 11");
	}

	@Test
	void testFetchRespectsMaxPages() throws Exception {
		// Given
		Path output = tempDir.resolve("reviews.csv");

		// When
		int exitCode = run("--output", output.toString(), "--max-pages", "1");

		// Then
		assertThat(exitCode).isZero();
		assertThat(requests.get()).isEqualTo(1);
		assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).hasSize(4);
	}

	@Test
	void testNoReviewsWritesNothing() {
		// Given
		reviewPages = 0;
		Path output = tempDir.resolve("reviews.csv");

		// When
		int exitCode = run("--output", output.toString());

		// Then
		assertThat(exitCode).isZero();
		assertThat(output).doesNotExist();
	}

	@Test
	void testInvalidDelayRangeFails() {
		assertThat(runFor("25506", "5", "1")).isEqualTo(1);
		assertThat(requests.get()).isZero();
	}

	@Test
	void testInvalidPoiIdFails() {
		// When
		int exitCode = runFor("abc", "0", "0");

		// Then
		assertThat(exitCode).isEqualTo(1);
		assertThat(requests.get()).isZero();
	}

	@Test
	void testPoiIdTooLargeFailsBeforeAnyRequest() {
		// When
		int exitCode = runFor("123456789012345678901234", "0", "0");

		// Then
		assertThat(exitCode).isEqualTo(1);
		assertThat(requests.get()).isZero();
	}

	@Test
	void testNonPositiveTimeoutFails() {
		assertThat(run("--timeout", "0")).isEqualTo(1);
		assertThat(run("--timeout", "-5")).isEqualTo(1);
		assertThat(new CommandLine(new Main()).execute("resolve", "--url", "http://127.0.0.1/1.html", "--timeout", "0"))
				.isEqualTo(1);
		assertThat(requests.get()).isZero();
	}

	@Test
	void testHelpExplainsHowToKeepTheLog() {
		// When
		String usage = new CommandLine(new Main()).getSubcommands().get("fetch").getUsageMessage();

		// Then
		assertThat(usage).contains("standard error").contains("-Dorg.slf4j.simpleLogger.logFile=spider.log");
	}
}
