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
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.awaitility.Awaitility;
import org.awaitility.core.ConditionTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.preview.ExecResult;
import org.springaicommunity.preview.SandboxException;
import org.springaicommunity.preview.SandboxTimeoutException;

/**
 * HTTP client for the envd agent inside an E2B sandbox (commands and files).
 *
 * <p>
 * Commands go through the Connect protocol's server-streaming framing; file transfers
 * use envd's plain {@code /files} endpoint.
 * </p>
 *
 * @since 0.1.0
 */
class E2BEnvdClient {

	private static final Logger logger = LoggerFactory.getLogger(E2BEnvdClient.class);

	private static final String CONTENT_TYPE_CONNECT_STREAM = "application/connect+json";

	private static final String CONTENT_TYPE_JSON = "application/json";

	private static final String ACCESS_TOKEN_HEADER = "X-Access-Token";

	private static final Duration READY_TIMEOUT = Duration.ofSeconds(60);

	private static final Duration READY_POLL_INTERVAL = Duration.ofMillis(500);

	private static final String HEALTH_ENDPOINT = "/health";

	private final String envdUrl;

	private final String accessToken;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	E2BEnvdClient(String envdUrl, String accessToken) {
		this.envdUrl = envdUrl;
		this.accessToken = accessToken;
		this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build();
		this.objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	}

	/**
	 * Waits for the envd service to become ready.
	 * @throws SandboxException if the service doesn't become ready within the timeout
	 */
	void waitForReady() {
		try {
			Awaitility.await()
				.atMost(READY_TIMEOUT.toSeconds(), TimeUnit.SECONDS)
				.pollInterval(READY_POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)
				.pollDelay(Duration.ZERO)
				.ignoreExceptions()
				.until(this::isEnvdReady);
			logger.debug("Envd service is ready");
		}
		catch (ConditionTimeoutException e) {
			throw new SandboxException("Envd service did not become ready within " + READY_TIMEOUT.toSeconds()
					+ " seconds. The sandbox may still be starting.", e);
		}
	}

	private boolean isEnvdReady() {
		try {
			HttpRequest httpRequest = request(HEALTH_ENDPOINT).GET().timeout(Duration.ofSeconds(5)).build();
			HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());

			if (response.statusCode() == 200 || response.statusCode() == 204) {
				return true;
			}
			if (response.statusCode() == 502) {
				logger.debug("Envd not ready yet (502), waiting...");
			}
			else {
				logger.debug("Unexpected response from envd health: {} - {}", response.statusCode(), response.body());
			}
			return false;
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			logger.debug("Failed to connect to envd: {}", e.getMessage());
			return false;
		}
	}

	/**
	 * Runs a shell script with {@code bash -l -c} and waits for it to exit.
	 * @param script the script
	 * @param workDir the working directory
	 * @param envVars environment variables
	 * @param timeout how long to wait for the whole exchange
	 * @return the execution result
	 */
	ExecResult runCommand(String script, String workDir, Map<String, String> envVars, Duration timeout) {
		Instant startTime = Instant.now();
		try {
			ProcessConfig processConfig = new ProcessConfig("/bin/bash", List.of("-l", "-c", script),
					envVars != null ? envVars : Map.of(), workDir);
			String jsonBody = objectMapper.writeValueAsString(new StartRequest(processConfig, false));

			HttpRequest httpRequest = request("/process.Process/Start")
				.header("Content-Type", CONTENT_TYPE_CONNECT_STREAM)
				.header("Connect-Protocol-Version", "1")
				.header("Connect-Content-Encoding", "identity")
				.POST(HttpRequest.BodyPublishers.ofByteArray(encodeEnvelope(jsonBody)))
				.build();

			logger.debug("Executing in {}: {}", workDir, script);

			// bounds the whole streamed exchange
			HttpResponse<byte[]> response = CompletableFuture.supplyAsync(() -> {
				try {
					return httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
				}
				catch (IOException | InterruptedException e) {
					if (e instanceof InterruptedException) {
						Thread.currentThread().interrupt();
					}
					throw new SandboxException("Failed to execute command", e);
				}
			}).orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).get();

			Duration duration = Duration.between(startTime, Instant.now());

			if (response.statusCode() != 200) {
				String errorBody = new String(response.body(), StandardCharsets.UTF_8);
				logger.error("Command execution failed: {} - {}", response.statusCode(), errorBody);
				throw new SandboxException("Command execution failed: " + response.statusCode() + " - " + errorBody);
			}

			return parseStreamingResponse(response.body(), duration);
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof TimeoutException) {
				throw new SandboxException("Command execution timed out",
						new SandboxTimeoutException("Command execution timed out after " + timeout, timeout));
			}
			if (cause instanceof SandboxException sandboxException) {
				throw sandboxException;
			}
			throw new SandboxException("Failed to execute command", cause);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new SandboxException("Command execution interrupted", e);
		}
		catch (IOException e) {
			throw new SandboxException("Failed to execute command", e);
		}
	}

	private ExecResult parseStreamingResponse(byte[] responseBody, Duration duration) throws IOException {
		StringBuilder stdout = new StringBuilder();
		StringBuilder stderr = new StringBuilder();
		int exitCode = -1;

		for (String json : parseEnvelopes(responseBody)) {
			EventWrapper wrapper = objectMapper.readValue(json, EventWrapper.class);
			ProcessEvent event = wrapper.event();
			if (event == null) {
				continue;
			}
			if (event.start() != null) {
				logger.debug("Process started with PID: {}", event.start().pid());
			}
			if (event.data() != null) {
				stdout.append(decodeBase64(event.data().stdout()));
				stderr.append(decodeBase64(event.data().stderr()));
			}
			if (event.end() != null) {
				exitCode = event.end().getExitCode();
				logger.debug("Command completed with exit code: {}", exitCode);
			}
		}

		return new ExecResult(exitCode, stdout.toString(), stderr.toString(), duration);
	}

	private static String decodeBase64(String encoded) {
		if (encoded == null || encoded.isEmpty()) {
			return "";
		}
		try {
			return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
		}
		catch (IllegalArgumentException e) {
			return encoded;
		}
	}

	/**
	 * Connect streaming envelope: 1 flag byte, 4 byte big-endian length, payload.
	 */
	static byte[] encodeEnvelope(String jsonData) {
		byte[] data = jsonData.getBytes(StandardCharsets.UTF_8);
		ByteBuffer buffer = ByteBuffer.allocate(5 + data.length);
		buffer.put((byte) 0);
		buffer.putInt(data.length);
		buffer.put(data);
		return buffer.array();
	}

	static List<String> parseEnvelopes(byte[] responseBody) {
		List<String> messages = new ArrayList<>();
		ByteBuffer buffer = ByteBuffer.wrap(responseBody);

		while (buffer.remaining() >= 5) {
			byte flags = buffer.get();
			int length = buffer.getInt();

			if (buffer.remaining() < length) {
				logger.warn("Incomplete envelope: expected {} bytes, have {}", length, buffer.remaining());
				break;
			}

			byte[] data = new byte[length];
			buffer.get(data);

			// 0x02 marks the end-of-stream trailers
			if ((flags & 0x02) != 0) {
				logger.debug("Received end-of-stream envelope: {}", new String(data, StandardCharsets.UTF_8));
				continue;
			}
			messages.add(new String(data, StandardCharsets.UTF_8));
		}

		return messages;
	}

	/**
	 * Writes a file, replacing any existing content.
	 * @param path the absolute file path
	 * @param content the file content
	 */
	void writeFile(String path, String content) {
		try {
			String boundary = "----PreviewFileBoundary" + System.nanoTime();

			ByteArrayOutputStream body = new ByteArrayOutputStream();
			body.write(("--" + boundary + "\r\n").getBytes(StandardCharsets.UTF_8));
			body.write(("Content-Disposition: form-data; name=\"file\"; filename=\"" + path + "\"\r\n")
				.getBytes(StandardCharsets.UTF_8));
			body.write("Content-Type: application/octet-stream\r\n\r\n".getBytes(StandardCharsets.UTF_8));
			body.write(content.getBytes(StandardCharsets.UTF_8));
			body.write(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));

			HttpRequest httpRequest = request(filesPath(path))
				.header("Content-Type", "multipart/form-data; boundary=" + boundary)
				.POST(HttpRequest.BodyPublishers.ofByteArray(body.toByteArray()))
				.timeout(Duration.ofSeconds(30))
				.build();
			HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());

			if (response.statusCode() != 200 && response.statusCode() != 201) {
				throw new SandboxException("Failed to write file: " + response.statusCode() + " - " + response.body());
			}
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new SandboxException("Failed to write file: " + path, e);
		}
	}

	/**
	 * Reads a file.
	 * @param path the absolute file path
	 * @return the file content
	 */
	String readFile(String path) {
		try {
			HttpRequest httpRequest = request(filesPath(path)).GET().timeout(Duration.ofSeconds(30)).build();
			HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());

			if (response.statusCode() != 200) {
				throw new SandboxException("Failed to read file: " + response.statusCode() + " - " + response.body());
			}
			return response.body();
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new SandboxException("Failed to read file: " + path, e);
		}
	}

	/**
	 * Checks if a file exists using the filesystem.Filesystem/Stat RPC.
	 * @param path the absolute path
	 * @return true if exists
	 */
	boolean exists(String path) {
		try {
			HttpRequest httpRequest = request("/filesystem.Filesystem/Stat")
				.header("Content-Type", CONTENT_TYPE_JSON)
				.header("Connect-Protocol-Version", "1")
				.POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(new PathRequest(path))))
				.timeout(Duration.ofSeconds(30))
				.build();
			HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
			return response.statusCode() == 200;
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new SandboxException("Failed to stat: " + path, e);
		}
	}

	/**
	 * Creates a directory and its parents. Idempotent.
	 * @param path the absolute directory path
	 */
	void makeDir(String path) {
		try {
			HttpRequest httpRequest = request("/filesystem.Filesystem/MakeDir")
				.header("Content-Type", CONTENT_TYPE_JSON)
				.header("Connect-Protocol-Version", "1")
				.POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(new PathRequest(path))))
				.timeout(Duration.ofSeconds(30))
				.build();
			HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());

			if (response.statusCode() != 200) {
				if (response.statusCode() == 409 && response.body().contains("already_exists")) {
					logger.debug("Directory already exists (ignored): {}", path);
					return;
				}
				throw new SandboxException(
						"Failed to create directory: " + response.statusCode() + " - " + response.body());
			}
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new SandboxException("Failed to create directory: " + path, e);
		}
	}

	private HttpRequest.Builder request(String path) {
		HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(envdUrl + path));
		// optional for sandboxes created without the secure flag
		if (accessToken != null && !accessToken.isEmpty()) {
			builder.header(ACCESS_TOKEN_HEADER, accessToken);
		}
		return builder;
	}

	private static String filesPath(String path) {
		return "/files?path=" + URLEncoder.encode(path, StandardCharsets.UTF_8);
	}

	// process.Process/Start messages

	record StartRequest(ProcessConfig process, boolean stdin) {
	}

	record ProcessConfig(String cmd, List<String> args, Map<String, String> envs, String cwd) {
	}

	record EventWrapper(ProcessEvent event) {
	}

	record ProcessEvent(StartEvent start, DataEvent data, EndEvent end) {
	}

	record StartEvent(int pid) {
	}

	record DataEvent(String stdout, String stderr) {
	}

	record EndEvent(@JsonProperty("exit_code") Integer exitCode, boolean exited, String status) {

		/**
		 * Gets the exit code, falling back to the status string ("exit status 1").
		 */
		int getExitCode() {
			if (exitCode != null) {
				return exitCode;
			}
			if (status != null && status.startsWith("exit status ")) {
				try {
					return Integer.parseInt(status.substring("exit status ".length()).trim());
				}
				catch (NumberFormatException e) {
					return -1;
				}
			}
			return exited ? 0 : -1;
		}
	}

	// filesystem.Filesystem Stat and MakeDir share the request shape

	record PathRequest(String path) {
	}

}
