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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
 * {@link ProviderAdapter} running previews in Daytona sandboxes.
 *
 * <p>
 * Sandboxes are created public from a Node image and must reach the {@code started}
 * state before files are uploaded. The dev server runs in a per-project process
 * session, installing dependencies first, and the preview URL comes from Daytona's
 * preview link endpoint once the link is provisioned and the server answers behind it.
 * </p>
 *
 * @since 0.1.0
 * @see <a href="https://www.daytona.io/docs">Daytona Documentation</a>
 */
public final class DaytonaProviderAdapter implements ProviderAdapter {

	private static final Logger logger = LoggerFactory.getLogger(DaytonaProviderAdapter.class);

	public static final String NAME = "daytona";

	static final String MANIFEST = "package.json";

	private final DaytonaConfig config;

	private final DaytonaApiClient apiClient;

	private final PreviewProbe probe;

	public DaytonaProviderAdapter(DaytonaConfig config) {
		this(config, new DaytonaApiClient(config), new PreviewProbe());
	}

	DaytonaProviderAdapter(DaytonaConfig config, DaytonaApiClient apiClient, PreviewProbe probe) {
		this.config = config;
		this.apiClient = apiClient;
		this.probe = probe;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public SandboxHandle create(SandboxConfig sandboxConfig, OutputListener output) {
		String name = sandboxConfig.projectId() + "-" + System.currentTimeMillis();
		Map<String, String> labels = new LinkedHashMap<>();
		labels.put("projectId", sandboxConfig.projectId());
		if (sandboxConfig.ownerId() != null) {
			labels.put("ownerId", sandboxConfig.ownerId());
		}

		String sandboxId = apiClient.createSandbox(name, labels).id();
		logger.info("Created Daytona sandbox {} ({}) for project {}", sandboxId, name, sandboxConfig.projectId());
		DaytonaSandboxFiles files = new DaytonaSandboxFiles(apiClient, sandboxId, config.workDir());
		try {
			apiClient.waitForStarted(sandboxId);
			files.makeDirectories(config.workDir());
		}
		catch (SandboxException e) {
			deleteQuietly(sandboxId);
			throw e;
		}
		output.onOutput(LogStream.INFO, "Daytona sandbox " + sandboxId + " is started");
		return new DaytonaSandboxHandle(sandboxId, sandboxConfig.projectId(), files, output);
	}

	@Override
	public void writeFiles(SandboxHandle handle, List<FileSpec> files) {
		DaytonaSandboxHandle sandbox = ProviderAdapter.unwrap(handle, DaytonaSandboxHandle.class);
		sandbox.files().setup(files);
		logger.debug("Uploaded {} file(s) to {}", files.size(), sandbox.id());
		boolean hasManifest = files.stream().anyMatch(file -> MANIFEST.equals(file.path()));
		if (hasManifest && !sandbox.files().exists(MANIFEST)) {
			throw new SandboxException(MANIFEST + " is missing in sandbox " + sandbox.id() + " after upload");
		}
	}

	@Override
	public InstallOutcome installDependencies(SandboxHandle handle) {
		DaytonaSandboxHandle sandbox = ProviderAdapter.unwrap(handle, DaytonaSandboxHandle.class);
		sandbox.output().onOutput(LogStream.INFO, "Dependencies are installed when the dev server starts");
		return InstallOutcome.DEFERRED;
	}

	@Override
	public String startServer(SandboxHandle handle) {
		DaytonaSandboxHandle sandbox = ProviderAdapter.unwrap(handle, DaytonaSandboxHandle.class);
		String sessionId = sessionIdFor(sandbox.projectId());
		apiClient.createSession(sandbox.id(), sessionId);
		DaytonaApiClient.SessionExecuteResponse response = apiClient.executeSessionCommand(sandbox.id(), sessionId,
				startScript(), true);
		sandbox.sessionId(sessionId);
		logger.info("Started dev server in Daytona sandbox {} (session {}, command {})", sandbox.id(), sessionId,
				response.cmdId());
		return "http://localhost:" + config.port();
	}

	String startScript() {
		return "(cd " + config.workDir() + " && " + config.installCommand() + " && " + config.serverCommandForPort()
				+ " > " + config.logFile() + " 2>&1) &";
	}

	static String sessionIdFor(String projectId) {
		return "preview-" + projectId.replaceAll("[^A-Za-z0-9_-]", "-");
	}

	@Override
	public Optional<String> getPreviewUrl(SandboxHandle handle) {
		DaytonaSandboxHandle sandbox = ProviderAdapter.unwrap(handle, DaytonaSandboxHandle.class);
		if (sandbox.sessionId() == null || sandbox.isDestroyed()) {
			return Optional.empty();
		}
		forwardServerLog(sandbox);
		DaytonaApiClient.PreviewLink link = apiClient.getPreviewLink(sandbox.id(), config.port());
		String url = link.url();
		if (url == null || !url.startsWith("http")) {
			logger.debug("Preview link for {} not provisioned yet: {}", sandbox.id(), url);
			return Optional.empty();
		}
		return probe.isServing(url) ? Optional.of(url) : Optional.empty();
	}

	private void forwardServerLog(DaytonaSandboxHandle sandbox) {
		String log;
		try {
			log = apiClient.downloadFile(sandbox.id(), config.workDir() + "/" + config.logFile());
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
	public void destroy(SandboxHandle handle) {
		DaytonaSandboxHandle sandbox = ProviderAdapter.unwrap(handle, DaytonaSandboxHandle.class);
		if (sandbox.isDestroyed()) {
			return;
		}
		apiClient.deleteSandbox(sandbox.id());
		sandbox.markDestroyed();
		logger.info("Deleted Daytona sandbox {} for project {}", sandbox.id(), sandbox.projectId());
	}

	private void deleteQuietly(String sandboxId) {
		try {
			apiClient.deleteSandbox(sandboxId);
		}
		catch (SandboxException e) {
			logger.warn("Failed to delete Daytona sandbox {} after failed startup: {}", sandboxId, e.getMessage());
		}
	}

}
