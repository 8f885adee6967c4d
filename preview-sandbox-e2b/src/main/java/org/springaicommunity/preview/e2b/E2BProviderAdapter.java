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

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.preview.ExecResult;
import org.springaicommunity.preview.FileSpec;
import org.springaicommunity.preview.InstallOutcome;
import org.springaicommunity.preview.LogStream;
import org.springaicommunity.preview.OutputListener;
import org.springaicommunity.preview.PreviewProbe;
import org.springaicommunity.preview.ProviderAdapter;
import org.springaicommunity.preview.SandboxConfig;
import org.springaicommunity.preview.SandboxException;
import org.springaicommunity.preview.SandboxHandle;

/**
 * {@link ProviderAdapter} running previews in E2B Firecracker microVMs.
 *
 * <p>
 * The sandbox is created through the E2B REST API and driven through its envd agent.
 * Dependencies are installed by the same backgrounded shell pipeline that starts the
 * dev server, so {@link #startServer(SandboxHandle)} returns right away and the public
 * URL {@code https://<port>-<sandboxId>.<domain>} is only reported once the dev server
 * answers behind it.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * PreviewSandboxManager manager = PreviewSandboxManager.builder()
 *     .provider(new E2BProviderAdapter(E2BConfig.builder().build()))
 *     .build();
 * }</pre>
 *
 * @since 0.1.0
 * @see <a href="https://e2b.dev">E2B Documentation</a>
 */
public final class E2BProviderAdapter implements ProviderAdapter {

	private static final Logger logger = LoggerFactory.getLogger(E2BProviderAdapter.class);

	public static final String NAME = "e2b";

	static final String MANIFEST = "package.json";

	private static final Duration START_COMMAND_TIMEOUT = Duration.ofSeconds(30);

	private final E2BConfig config;

	private final E2BApiClient apiClient;

	private final BiFunction<String, String, E2BEnvdClient> envdClients;

	private final PreviewProbe probe;

	public E2BProviderAdapter(E2BConfig config) {
		this(config, new E2BApiClient(config), E2BEnvdClient::new, new PreviewProbe());
	}

	E2BProviderAdapter(E2BConfig config, E2BApiClient apiClient, BiFunction<String, String, E2BEnvdClient> envdClients,
			PreviewProbe probe) {
		this.config = config;
		this.apiClient = apiClient;
		this.envdClients = envdClients;
		this.probe = probe;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public SandboxHandle create(SandboxConfig sandboxConfig, OutputListener output) {
		String name = sandboxConfig.projectId() + "-" + System.currentTimeMillis();
		Map<String, String> metadata = new LinkedHashMap<>();
		metadata.put("name", name);
		metadata.put("projectId", sandboxConfig.projectId());
		if (sandboxConfig.ownerId() != null) {
			metadata.put("ownerId", sandboxConfig.ownerId());
		}

		E2BApiClient.SandboxResponse response = apiClient.createSandbox(config.template(),
				config.sandboxTimeout().toSeconds(), config.environment(), metadata);
		String sandboxId = response.sandboxId();
		logger.info("Created E2B sandbox {} ({}) for project {}", sandboxId, name, sandboxConfig.projectId());

		E2BEnvdClient envdClient = envdClients.apply(apiClient.getEnvdUrl(sandboxId, response.domain()),
				response.envdAccessToken());
		try {
			envdClient.waitForReady();
		}
		catch (SandboxException e) {
			killQuietly(sandboxId);
			throw e;
		}
		output.onOutput(LogStream.INFO, "E2B sandbox " + sandboxId + " is reachable");
		return new E2BSandboxHandle(sandboxId, sandboxConfig.projectId(), response.domain(), envdClient,
				config.workDir(), output);
	}

	@Override
	public void writeFiles(SandboxHandle handle, List<FileSpec> files) {
		E2BSandboxHandle sandbox = ProviderAdapter.unwrap(handle, E2BSandboxHandle.class);
		sandbox.files().setup(files);
		logger.debug("Uploaded {} file(s) to {}", files.size(), sandbox.id());
		boolean hasManifest = files.stream().anyMatch(file -> MANIFEST.equals(file.path()));
		if (hasManifest && !sandbox.files().exists(MANIFEST)) {
			throw new SandboxException(MANIFEST + " is missing in sandbox " + sandbox.id() + " after upload");
		}
	}

	@Override
	public InstallOutcome installDependencies(SandboxHandle handle) {
		E2BSandboxHandle sandbox = ProviderAdapter.unwrap(handle, E2BSandboxHandle.class);
		sandbox.output().onOutput(LogStream.INFO, "Dependencies are installed when the dev server starts");
		return InstallOutcome.DEFERRED;
	}

	@Override
	public String startServer(SandboxHandle handle) {
		E2BSandboxHandle sandbox = ProviderAdapter.unwrap(handle, E2BSandboxHandle.class);
		String script = startScript();
		ExecResult result = sandbox.envdClient()
			.runCommand(script, config.workDir(), config.environment(), START_COMMAND_TIMEOUT);
		if (result.failed()) {
			throw new SandboxException(
					"Failed to start dev server in sandbox " + sandbox.id() + ": " + result.outputTail(2000));
		}
		sandbox.markServerStarted();
		logger.info("Started dev server in E2B sandbox {} on port {}", sandbox.id(), config.port());
		return publicUrl(sandbox);
	}

	String startScript() {
		String pipeline = config.installCommand() + " && " + config.serverCommandForPort();
		return "cd " + shellQuote(config.workDir()) + " && nohup sh -c " + shellQuote(pipeline) + " > "
				+ shellQuote(config.workDir() + "/" + config.logFile()) + " 2>&1 &";
	}

	static String shellQuote(String value) {
		return "'" + value.replace("'", "'\\''") + "'";
	}

	@Override
	public Optional<String> getPreviewUrl(SandboxHandle handle) {
		E2BSandboxHandle sandbox = ProviderAdapter.unwrap(handle, E2BSandboxHandle.class);
		if (!sandbox.isServerStarted() || sandbox.isDestroyed()) {
			return Optional.empty();
		}
		forwardServerLog(sandbox);
		String url = publicUrl(sandbox);
		return probe.isServing(url) ? Optional.of(url) : Optional.empty();
	}

	private void forwardServerLog(E2BSandboxHandle sandbox) {
		String log;
		try {
			log = sandbox.envdClient().readFile(config.workDir() + "/" + config.logFile());
		}
		catch (SandboxException e) {
			logger.debug("Could not read dev server log in {}: {}", sandbox.id(), e.getMessage());
			return;
		}
		for (String line : sandbox.unforwardedLog(log).split("\\R")) {
			if (!line.isBlank()) {
				sandbox.output().onOutput(LogStream.STDOUT, line);
			}
		}
	}

	@Override
	public void extendLease(SandboxHandle handle, Duration remaining) {
		E2BSandboxHandle sandbox = ProviderAdapter.unwrap(handle, E2BSandboxHandle.class);
		apiClient.setTimeout(sandbox.id(), Math.max(1, remaining.toSeconds()));
	}

	@Override
	public void destroy(SandboxHandle handle) {
		E2BSandboxHandle sandbox = ProviderAdapter.unwrap(handle, E2BSandboxHandle.class);
		if (sandbox.isDestroyed()) {
			return;
		}
		apiClient.killSandbox(sandbox.id());
		sandbox.markDestroyed();
		logger.info("Killed E2B sandbox {} for project {}", sandbox.id(), sandbox.projectId());
	}

	private String publicUrl(E2BSandboxHandle sandbox) {
		return "https://" + apiClient.getHost(config.port(), sandbox.id(), sandbox.domain());
	}

	private void killQuietly(String sandboxId) {
		try {
			apiClient.killSandbox(sandboxId);
		}
		catch (SandboxException e) {
			logger.warn("Failed to kill E2B sandbox {} after failed startup: {}", sandboxId, e.getMessage());
		}
	}

}
