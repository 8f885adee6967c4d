/*
 * Copyright 2024 Spring AI Community
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.springaicommunity.preview.e2b;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springaicommunity.preview.ExecResult;
import org.springaicommunity.preview.SandboxException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link E2BEnvdClient} against an in-process HTTP server speaking the envd
 * endpoints.
 */
class E2BEnvdClientTest {

	private final Map<String, String> requests = new ConcurrentHashMap<>();

	private final Map<String, String> files = new ConcurrentHashMap<>();

	private volatile byte[] processResponse = new byte[0];

	private HttpServer server;

	private E2BEnvdClient client;

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/health", exchange -> respond(exchange, 204, new byte[0]));
		server.createContext("/process.Process/Start", this::start);
		server.createContext("/files", this::files);
		server.createContext("/filesystem.Filesystem/MakeDir", this::makeDir);
		server.createContext("/filesystem.Filesystem/Stat", this::stat);
		server.start();
		client = new E2BEnvdClient("http://127.0.0.1:" + server.getAddress().getPort(), "token");
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
	}

	@Test
	void waitForReadyReturnsOnceHealthAnswers() {
		assertThatCode(() -> client.waitForReady()).doesNotThrowAnyException();
	}

	@Test
	void runCommandCollectsStreamedOutputAndExitCode() {
		processResponse = concat(envelope(0, "{\"event\":{\"start\":{\"pid\":42}}}"),
				envelope(0, "{\"event\":{\"data\":{\"stdout\":\"" + base64("hello\n") + "\"}}}"),
				envelope(0, "{\"event\":{\"data\":{\"stderr\":\"" + base64("warn\n") + "\"}}}"),
				envelope(0, "{\"event\":{\"end\":{\"exited\":true,\"status\":\"exit status 3\"}}}"),
				envelope(2, "{}"));

		ExecResult result = client.runCommand("echo hello", "/home/user", Map.of("CI", "1"), Duration.ofSeconds(5));

		assertThat(result.exitCode()).isEqualTo(3);
		assertThat(result.stdout()).isEqualTo("hello\n");
		assertThat(result.stderr()).isEqualTo("warn\n");
		assertThat(requests.get("start")).contains("\"cmd\":\"/bin/bash\"")
			.contains("\"args\":[\"-l\",\"-c\",\"echo hello\"]")
			.contains("\"cwd\":\"/home/user\"");
		assertThat(requests.get("token")).isEqualTo("token");
	}

	@Test
	void envelopesAreDecodedUntilTrailers() {
		byte[] body = concat(envelope(0, "{\"a\":1}"), envelope(2, "{\"error\":null}"), envelope(0, "{\"b\":2}"));

		List<String> messages = E2BEnvdClient.parseEnvelopes(body);

		assertThat(messages).containsExactly("{\"a\":1}", "{\"b\":2}");
	}

	@Test
	void truncatedEnvelopeIsIgnored() {
		byte[] whole = envelope(0, "{\"a\":1}");
		byte[] truncated = new byte[whole.length - 2];
		System.arraycopy(whole, 0, truncated, 0, truncated.length);

		assertThat(E2BEnvdClient.parseEnvelopes(truncated)).isEmpty();
	}

	@Test
	void filesRoundTripThroughFilesEndpoint() {
		client.writeFile("/home/user/app/index.tsx", "export default null;");

		assertThat(client.readFile("/home/user/app/index.tsx")).isEqualTo("export default null;");
	}

	@Test
	void readingMissingFileFails() {
		assertThatThrownBy(() -> client.readFile("/home/user/missing.txt")).isInstanceOf(SandboxException.class)
			.hasMessageContaining("404");
	}

	@Test
	void makeDirToleratesExistingDirectory() {
		assertThatCode(() -> client.makeDir("/home/user/app")).doesNotThrowAnyException();
		assertThatCode(() -> client.makeDir("/home/user/app")).doesNotThrowAnyException();
	}

	@Test
	void existsUsesStat() {
		files.put("/home/user/package.json", "{}");

		assertThat(client.exists("/home/user/package.json")).isTrue();
		assertThat(client.exists("/home/user/nope.json")).isFalse();
	}

	private void start(HttpExchange exchange) throws IOException {
		byte[] body = exchange.getRequestBody().readAllBytes();
		requests.put("start", E2BEnvdClient.parseEnvelopes(body).get(0));
		requests.put("token", String.valueOf(exchange.getRequestHeaders().getFirst("X-Access-Token")));
		respond(exchange, 200, processResponse);
	}

	private void files(HttpExchange exchange) throws IOException {
		String query = exchange.getRequestURI().getQuery();
		String path = query.substring("path=".length());
		if ("POST".equals(exchange.getRequestMethod())) {
			String multipart = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
			int start = multipart.indexOf("\r\n\r\n") + 4;
			int end = multipart.lastIndexOf("\r\n--");
			files.put(path, multipart.substring(start, end));
			respond(exchange, 200, "[]".getBytes(StandardCharsets.UTF_8));
			return;
		}
		String content = files.get(path);
		if (content == null) {
			respond(exchange, 404, "{\"message\":\"file not found\"}".getBytes(StandardCharsets.UTF_8));
			return;
		}
		respond(exchange, 200, content.getBytes(StandardCharsets.UTF_8));
	}

	private void makeDir(HttpExchange exchange) throws IOException {
		String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
		if (requests.putIfAbsent("mkdir " + body, body) != null) {
			respond(exchange, 409, "{\"code\":\"already_exists\"}".getBytes(StandardCharsets.UTF_8));
			return;
		}
		respond(exchange, 200, "{}".getBytes(StandardCharsets.UTF_8));
	}

	private void stat(HttpExchange exchange) throws IOException {
		String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
		boolean found = files.keySet().stream().anyMatch(path -> body.contains("\"" + path + "\""));
		respond(exchange, found ? 200 : 404, "{}".getBytes(StandardCharsets.UTF_8));
	}

	private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
		exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(body);
		}
	}

	private static byte[] envelope(int flags, String json) {
		byte[] data = json.getBytes(StandardCharsets.UTF_8);
		return ByteBuffer.allocate(5 + data.length).put((byte) flags).putInt(data.length).put(data).array();
	}

	private static byte[] concat(byte[]... parts) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		for (byte[] part : parts) {
			out.writeBytes(part);
		}
		return out.toByteArray();
	}

	private static String base64(String text) {
		return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
	}

}
