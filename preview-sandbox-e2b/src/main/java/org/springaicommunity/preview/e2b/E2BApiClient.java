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
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.preview.SandboxException;

/**
 * HTTP client for the E2B sandbox lifecycle REST API.
 *
 * @since 0.1.0
 */
class E2BApiClient {

	private static final Logger logger = LoggerFactory.getLogger(E2BApiClient.class);

	private static final String API_KEY_HEADER = "X-API-Key";

	private static final String CONTENT_TYPE = "application/json";

	/** Port the envd agent listens on inside every sandbox. */
	static final int ENVD_PORT = 49983;

	private final E2BConfig config;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	E2BApiClient(E2BConfig config) {
		this.config = config;
		this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build();
		this.objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	}

	/**
	 * Creates a new sandbox.
	 * @param templateId the template ID to use
	 * @param timeoutSeconds seconds until E2B kills the sandbox unless extended
	 * @param envVars environment variables for the sandbox
	 * @param metadata labels shown in the E2B dashboard
	 * @return the sandbox creation response
	 */
	SandboxResponse createSandbox(String templateId, long timeoutSeconds, Map<String, String> envVars,
			Map<String, String> metadata) {
		try {
			CreateSandboxRequest request = new CreateSandboxRequest(templateId, timeoutSeconds, envVars, metadata,
					true);
			String body = objectMapper.writeValueAsString(request);

			HttpRequest httpRequest = HttpRequest.newBuilder()
				.uri(URI.create(config.apiUrl() + "/sandboxes"))
				.header(API_KEY_HEADER, config.apiKey())
				.header("Content-Type", CONTENT_TYPE)
				.POST(HttpRequest.BodyPublishers.ofString(body))
				.timeout(Duration.ofSeconds(60))
				.build();

			logger.debug("Creating sandbox with template: {}", templateId);
			HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());

			if (response.statusCode() != 201 && response.statusCode() != 200) {
				throw new SandboxException(
						"Failed to create sandbox: " + response.statusCode() + " - " + response.body());
			}

			SandboxResponse sandboxResponse = objectMapper.readValue(response.body(), SandboxResponse.class);
			if (sandboxResponse.sandboxId() == null || sandboxResponse.sandboxId().isBlank()) {
				throw new SandboxException("Sandbox creation response has no sandbox id: " + response.body());
			}
			logger.debug("Created sandbox: {}", sandboxResponse.sandboxId());
			return sandboxResponse;
		}
		catch (JsonProcessingException e) {
			throw new SandboxException("Failed to process sandbox request", e);
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new SandboxException("Failed to create sandbox", e);
		}
	}

	/**
	 * Kills a sandbox. A sandbox that is already gone counts as killed.
	 * @param sandboxId the sandbox ID to kill
	 */
	void killSandbox(String sandboxId) {
		try {
			HttpRequest httpRequest = HttpRequest.newBuilder()
				.uri(URI.create(config.apiUrl() + "/sandboxes/" + sandboxId))
				.header(API_KEY_HEADER, config.apiKey())
				.DELETE()
				.timeout(Duration.ofSeconds(30))
				.build();

			logger.debug("Killing sandbox: {}", sandboxId);
			HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());

			// 204 = success, 404 = already killed, 409 = kill already in progress
			int status = response.statusCode();
			if (status != 204 && status != 200 && status != 404 && status != 409) {
				throw new SandboxException("Failed to kill sandbox: " + status + " - " + response.body());
			}
			logger.debug("Killed sandbox: {}", sandboxId);
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new SandboxException("Failed to kill sandbox: " + sandboxId, e);
		}
	}

	/**
	 * Resets the sandbox timeout.
	 * @param sandboxId the sandbox ID
	 * @param timeoutSeconds new timeout in seconds from now
	 */
	void setTimeout(String sandboxId, long timeoutSeconds) {
		try {
			String body = objectMapper.writeValueAsString(new TimeoutRequest(timeoutSeconds));

			HttpRequest httpRequest = HttpRequest.newBuilder()
				.uri(URI.create(config.apiUrl() + "/sandboxes/" + sandboxId + "/timeout"))
				.header(API_KEY_HEADER, config.apiKey())
				.header("Content-Type", CONTENT_TYPE)
				.POST(HttpRequest.BodyPublishers.ofString(body))
				.timeout(Duration.ofSeconds(30))
				.build();

			HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());

			if (response.statusCode() != 204 && response.statusCode() != 200) {
				throw new SandboxException(
						"Failed to set sandbox timeout: " + response.statusCode() + " - " + response.body());
			}
			logger.debug("Sandbox {} now times out in {}s", sandboxId, timeoutSeconds);
		}
		catch (JsonProcessingException e) {
			throw new SandboxException("Failed to serialize timeout request", e);
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new SandboxException("Failed to set sandbox timeout: " + sandboxId, e);
		}
	}

	/**
	 * Gets the public host that forwards to a port inside the sandbox.
	 * @param port the port inside the sandbox
	 * @param sandboxId the sandbox ID
	 * @param domain the sandbox domain from the creation response
	 * @return the host name, without scheme
	 */
	String getHost(int port, String sandboxId, String domain) {
		String actualDomain = domain != null && !domain.isEmpty() ? domain : config.domain();
		return port + "-" + sandboxId + "." + actualDomain;
	}

	/**
	 * Gets the envd URL for a sandbox.
	 * @param sandboxId the sandbox ID
	 * @param domain the sandbox domain from the creation response
	 * @return the envd URL
	 */
	String getEnvdUrl(String sandboxId, String domain) {
		String url = "https://" + getHost(ENVD_PORT, sandboxId, domain);
		logger.debug("Constructed envd URL: {}", url);
		return url;
	}

	/**
	 * Request payload for creating a sandbox.
	 */
	record CreateSandboxRequest(String templateID, long timeout, Map<String, String> envVars,
			Map<String, String> metadata, boolean secure) {
	}

	record TimeoutRequest(long timeout) {
	}

	/**
	 * Response from sandbox creation.
	 */
	record SandboxResponse(@JsonProperty("sandboxID") String sandboxId, @JsonProperty("templateID") String templateId,
			String domain, String envdAccessToken, String envdVersion) {
	}

}
