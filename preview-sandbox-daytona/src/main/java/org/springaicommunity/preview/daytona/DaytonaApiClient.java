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
package org.springaicommunity.preview.daytona;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.awaitility.Awaitility;
import org.awaitility.core.ConditionTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.preview.SandboxException;

/**
 * HTTP client for the Daytona REST API: sandbox lifecycle, the toolbox file and process
 * endpoints, and preview links.
 *
 * @since 0.1.0
 */
class DaytonaApiClient {

	private static final Logger logger = LoggerFactory.getLogger(DaytonaApiClient.class);

	private static final String CONTENT_TYPE = "application/json";

	static final String STATE_STARTED = "started";

	private static final Set<String> FAILED_STATES = Set.of("error", "build_failed", "destroyed");

	private final DaytonaConfig config;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	DaytonaApiClient(DaytonaConfig config) {
		this.config = config;
		this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build();
		this.objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	}

	/**
	 * Creates a new sandbox.
	 * @param name unique sandbox name
	 * @param labels labels shown in the Daytona dashboard
	 * @return the created sandbox
	 */
	SandboxResponse createSandbox(String name, Map<String, String> labels) {
		CreateSandboxRequest request = new CreateSandboxRequest(name, config.image(), true, labels,
				config.environment());
		logger.debug("Creating sandbox {} from image {}", name, config.image());
		HttpResponse<String> response = send(jsonRequest("/sandbox", request).timeout(Duration.ofSeconds(60)).build(),
				"create sandbox " + name);
		if (response.statusCode() != 200 && response.statusCode() != 201) {
			throw new SandboxException("Failed to create sandbox: " + response.statusCode() + " - " + response.body());
		}
		SandboxResponse sandbox = read(response.body(), SandboxResponse.class);
		if (sandbox.id() == null || sandbox.id().isBlank()) {
			throw new SandboxException("Sandbox creation response has no sandbox id: " + response.body());
		}
		logger.debug("Created sandbox {} in state {}", sandbox.id(), sandbox.state());
		return sandbox;
	}

	SandboxResponse getSandbox(String sandboxId) {
		HttpResponse<String> response = send(request("/sandbox/" + sandboxId).GET().build(), "get sandbox " + sandboxId);
		if (response.statusCode() != 200) {
			throw new SandboxException(
					"Failed to get sandbox " + sandboxId + ": " + response.statusCode() + " - " + response.body());
		}
		return read(response.body(), SandboxResponse.class);
	}

	/**
	 * Waits until the sandbox reaches the {@code started} state.
	 * @param sandboxId the sandbox ID
	 * @throws SandboxException if the sandbox fails or does not start in time
	 */
	void waitForStarted(String sandboxId) {
		AtomicReference<String> lastState = new AtomicReference<>("unknown");
		try {
			Awaitility.await()
				.atMost(config.startTimeout())
				.pollInterval(config.startPollInterval())
				.pollDelay(Duration.ZERO)
				.until(() -> isStarted(sandboxId, lastState));
			logger.debug("Sandbox {} is started", sandboxId);
		}
		catch (ConditionTimeoutException e) {
			throw new SandboxException("Sandbox " + sandboxId + " did not start within "
					+ config.startTimeout().toSeconds() + " seconds (last state: " + lastState.get() + ")", e);
		}
	}

	private boolean isStarted(String sandboxId, AtomicReference<String> lastState) {
		SandboxResponse sandbox;
		try {
			sandbox = getSandbox(sandboxId);
		}
		catch (SandboxException e) {
			logger.debug("Sandbox {} state unavailable: {}", sandboxId, e.getMessage());
			return false;
		}
		String state = sandbox.state() != null ? sandbox.state().toLowerCase() : "unknown";
		lastState.set(state);
		if (FAILED_STATES.contains(state)) {
			throw new SandboxException("Sandbox " + sandboxId + " failed to start: " + state
					+ (sandbox.errorReason() != null ? " (" + sandbox.errorReason() + ")" : ""));
		}
		return STATE_STARTED.equals(state);
	}

	/**
	 * Runs a command synchronously through the toolbox.
	 * @param sandboxId the sandbox ID
	 * @param command the command line
	 * @param cwd the working directory, or {@code null} for the default
	 * @param timeout how long the toolbox may run the command
	 * @return the command result
	 */
	ExecuteResponse executeCommand(String sandboxId, String command, String cwd, Duration timeout) {
		ExecuteRequest request = new ExecuteRequest(command, cwd, timeout.toSeconds());
		HttpResponse<String> response = send(
				jsonRequest(toolbox(sandboxId, "/process/execute"), request).timeout(timeout.plusSeconds(30)).build(),
				"execute command in " + sandboxId);
		if (response.statusCode() != 200) {
			throw new SandboxException("Failed to execute command: " + response.statusCode() + " - " + response.body());
		}
		return read(response.body(), ExecuteResponse.class);
	}

	/**
	 * Uploads a file, replacing any existing content.
	 * @param sandboxId the sandbox ID
	 * @param path the absolute file path
	 * @param content the file content
	 */
	void uploadFile(String sandboxId, String path, String content) {
		String boundary = "----PreviewFileBoundary" + System.nanoTime();
		ByteArrayOutputStream body = new ByteArrayOutputStream();
		body.writeBytes(("--" + boundary + "\r\n").getBytes(StandardCharsets.UTF_8));
		body.writeBytes(("Content-Disposition: form-data; name=\"file\"; filename=\"" + fileName(path) + "\"\r\n")
			.getBytes(StandardCharsets.UTF_8));
		body.writeBytes("Content-Type: application/octet-stream\r\n\r\n".getBytes(StandardCharsets.UTF_8));
		body.writeBytes(content.getBytes(StandardCharsets.UTF_8));
		body.writeBytes(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));

		HttpRequest request = request(toolbox(sandboxId, "/files/upload?path=" + encode(path)))
			.header("Content-Type", "multipart/form-data; boundary=" + boundary)
			.POST(HttpRequest.BodyPublishers.ofByteArray(body.toByteArray()))
			.timeout(Duration.ofSeconds(30))
			.build();
		HttpResponse<String> response = send(request, "upload " + path);
		if (response.statusCode() != 200 && response.statusCode() != 201) {
			throw new SandboxException("Failed to upload file: " + response.statusCode() + " - " + response.body());
		}
	}

	String downloadFile(String sandboxId, String path) {
		HttpRequest request = request(toolbox(sandboxId, "/files/download?path=" + encode(path))).GET()
			.timeout(Duration.ofSeconds(30))
			.build();
		HttpResponse<String> response = send(request, "download " + path);
		if (response.statusCode() != 200) {
			throw new SandboxException("Failed to read file: " + response.statusCode() + " - " + response.body());
		}
		return response.body();
	}

	boolean fileExists(String sandboxId, String path) {
		HttpRequest request = request(toolbox(sandboxId, "/files/info?path=" + encode(path))).GET()
			.timeout(Duration.ofSeconds(30))
			.build();
		HttpResponse<String> response = send(request, "stat " + path);
		if (response.statusCode() == 200) {
			return true;
		}
		if (response.statusCode() == 404 || response.statusCode() == 400) {
			return false;
		}
		throw new SandboxException("Failed to stat file: " + response.statusCode() + " - " + response.body());
	}

	/**
	 * Creates a process session. An existing session with the same id is reused.
	 * @param sandboxId the sandbox ID
	 * @param sessionId the session ID
	 */
	void createSession(String sandboxId, String sessionId) {
		HttpResponse<String> response = send(
				jsonRequest(toolbox(sandboxId, "/process/session"), new CreateSessionRequest(sessionId))
					.timeout(Duration.ofSeconds(30))
					.build(),
				"create session " + sessionId);
		if (response.statusCode() == 409) {
			logger.debug("Session {} already exists in {}", sessionId, sandboxId);
			return;
		}
		if (response.statusCode() != 200 && response.statusCode() != 201) {
			throw new SandboxException("Failed to create session: " + response.statusCode() + " - " + response.body());
		}
	}

	SessionExecuteResponse executeSessionCommand(String sandboxId, String sessionId, String command,
			boolean runAsync) {
		HttpResponse<String> response = send(
				jsonRequest(toolbox(sandboxId, "/process/session/" + sessionId + "/exec"),
						new SessionExecuteRequest(command, runAsync))
					.timeout(Duration.ofSeconds(60))
					.build(),
				"execute session command in " + sandboxId);
		if (response.statusCode() != 200 && response.statusCode() != 202) {
			throw new SandboxException(
					"Failed to execute session command: " + response.statusCode() + " - " + response.body());
		}
		return read(response.body(), SessionExecuteResponse.class);
	}

	/**
	 * Gets the public preview link for a port. Daytona provisions links asynchronously,
	 * so the URL may still be a placeholder.
	 * @param sandboxId the sandbox ID
	 * @param port the port inside the sandbox
	 * @return the preview link
	 */
	PreviewLink getPreviewLink(String sandboxId, int port) {
		HttpRequest request = request("/sandbox/" + sandboxId + "/ports/" + port + "/preview-url").GET()
			.timeout(Duration.ofSeconds(15))
			.build();
		HttpResponse<String> response = send(request, "get preview link for " + sandboxId);
		if (response.statusCode() != 200) {
			throw new SandboxException(
					"Failed to get preview link: " + response.statusCode() + " - " + response.body());
		}
		return read(response.body(), PreviewLink.class);
	}

	/**
	 * Deletes a sandbox. A sandbox that is already gone or being deleted counts as
	 * deleted.
	 * @param sandboxId the sandbox ID
	 */
	void deleteSandbox(String sandboxId) {
		HttpRequest request = request("/sandbox/" + sandboxId).DELETE().timeout(Duration.ofSeconds(30)).build();
		logger.debug("Deleting sandbox: {}", sandboxId);
		HttpResponse<String> response = send(request, "delete sandbox " + sandboxId);
		int status = response.statusCode();
		if (status == 404 || status == 409) {
			logger.debug("Sandbox {} already deleted or being modified ({})", sandboxId, status);
			return;
		}
		if (status != 200 && status != 204) {
			throw new SandboxException("Failed to delete sandbox: " + status + " - " + response.body());
		}
	}

	private HttpRequest.Builder request(String path) {
		return HttpRequest.newBuilder()
			.uri(URI.create(config.apiUrl() + path))
			.header("Authorization", "Bearer " + config.apiKey());
	}

	private HttpRequest.Builder jsonRequest(String path, Object body) {
		try {
			return request(path).header("Content-Type", CONTENT_TYPE)
				.POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
		}
		catch (JsonProcessingException e) {
			throw new SandboxException("Failed to serialize request to " + path, e);
		}
	}

	private HttpResponse<String> send(HttpRequest request, String action) {
		try {
			return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new SandboxException("Failed to " + action, e);
		}
	}

	private <T> T read(String body, Class<T> type) {
		try {
			return objectMapper.readValue(body, type);
		}
		catch (JsonProcessingException e) {
			throw new SandboxException("Failed to parse " + type.getSimpleName() + ": " + body, e);
		}
	}

	private static String toolbox(String sandboxId, String path) {
		return "/toolbox/" + sandboxId + "/toolbox" + path;
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	private static String fileName(String path) {
		int slash = path.lastIndexOf('/');
		return slash >= 0 ? path.substring(slash + 1) : path;
	}

	record CreateSandboxRequest(String name, String image, @JsonProperty("public") boolean isPublic,
			Map<String, String> labels, Map<String, String> env) {
	}

	record SandboxResponse(String id, String name, String state, String errorReason) {
	}

	record ExecuteRequest(String command, String cwd, long timeout) {
	}

	record ExecuteResponse(int exitCode, String result) {
	}

	record CreateSessionRequest(String sessionId) {
	}

	record SessionExecuteRequest(String command, boolean runAsync) {
	}

	record SessionExecuteResponse(String cmdId, Integer exitCode, String output) {
	}

	record PreviewLink(String url, String token) {
	}

}
