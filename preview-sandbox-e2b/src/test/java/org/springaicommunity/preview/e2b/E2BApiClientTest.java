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

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springaicommunity.preview.SandboxException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link E2BApiClient} against an in-process HTTP server.
 */
class E2BApiClientTest {

	private final Map<String, String> requests = new ConcurrentHashMap<>();

	private final Map<String, Integer> statuses = new ConcurrentHashMap<>();

	private HttpServer server;

	private E2BApiClient client;

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/", this::handle);
		server.start();
		E2BConfig config = E2BConfig.builder("test-key")
			.apiUrl("http://127.0.0.1:" + server.getAddress().getPort())
			.domain("e2b.dev")
			.build();
		client = new E2BApiClient(config);
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
	}

	@Test
	void createSandboxSendsTemplateTimeoutAndMetadata() {
		statuses.put("POST /sandboxes", 201);

		E2BApiClient.SandboxResponse response = client.createSandbox("base", 900, Map.of("CI", "1"),
				Map.of("projectId", "p1"));

		assertThat(response.sandboxId()).isEqualTo("sbx1");
		assertThat(response.domain()).isEqualTo("e2b.app");
		assertThat(response.envdAccessToken()).isEqualTo("token");
		assertThat(requests.get("POST /sandboxes")).contains("\"templateID\":\"base\"")
			.contains("\"timeout\":900")
			.contains("\"metadata\":{\"projectId\":\"p1\"}")
			.contains("\"secure\":true");
		assertThat(requests.get("X-API-Key")).isEqualTo("test-key");
	}

	@Test
	void createSandboxFailureCarriesStatusAndBody() {
		statuses.put("POST /sandboxes", 429);

		assertThatThrownBy(() -> client.createSandbox("base", 900, Map.of(), Map.of()))
			.isInstanceOf(SandboxException.class)
			.hasMessageContaining("429");
	}

	@Test
	void killTreatsMissingSandboxAsKilled() {
		statuses.put("DELETE /sandboxes/gone", 404);
		statuses.put("DELETE /sandboxes/busy", 409);
		statuses.put("DELETE /sandboxes/sbx1", 204);

		assertThatCode(() -> client.killSandbox("gone")).doesNotThrowAnyException();
		assertThatCode(() -> client.killSandbox("busy")).doesNotThrowAnyException();
		assertThatCode(() -> client.killSandbox("sbx1")).doesNotThrowAnyException();
	}

	@Test
	void killFailsOnServerError() {
		statuses.put("DELETE /sandboxes/sbx1", 500);

		assertThatThrownBy(() -> client.killSandbox("sbx1")).isInstanceOf(SandboxException.class)
			.hasMessageContaining("500");
	}

	@Test
	void setTimeoutPostsSeconds() {
		statuses.put("POST /sandboxes/sbx1/timeout", 204);

		client.setTimeout("sbx1", 600);

		assertThat(requests.get("POST /sandboxes/sbx1/timeout")).isEqualTo("{\"timeout\":600}");
	}

	@Test
	void hostsUseResponseDomainWithConfigFallback() {
		assertThat(client.getHost(8081, "sbx1", "e2b.app")).isEqualTo("8081-sbx1.e2b.app");
		assertThat(client.getHost(8081, "sbx1", null)).isEqualTo("8081-sbx1.e2b.dev");
		assertThat(client.getEnvdUrl("sbx1", "e2b.app")).isEqualTo("https://49983-sbx1.e2b.app");
	}

	private void handle(HttpExchange exchange) throws IOException {
		String key = exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath();
		requests.put(key, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
		String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
		if (apiKey != null) {
			requests.put("X-API-Key", apiKey);
		}
		int status = statuses.getOrDefault(key, 404);
		String body = status == 201
				? "{\"sandboxID\":\"sbx1\",\"templateID\":\"base\",\"domain\":\"e2b.app\","
						+ "\"envdAccessToken\":\"token\",\"envdVersion\":\"0.2.0\",\"alias\":\"base\"}"
				: (status == 204 ? "" : "{\"code\":" + status + ",\"message\":\"error\"}");
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}

}
