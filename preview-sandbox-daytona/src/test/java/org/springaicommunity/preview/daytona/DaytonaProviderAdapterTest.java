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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springaicommunity.preview.FileSpec;
import org.springaicommunity.preview.InstallOutcome;
import org.springaicommunity.preview.PreviewProbe;
import org.springaicommunity.preview.SandboxConfig;
import org.springaicommunity.preview.SandboxException;
import org.springaicommunity.preview.SandboxHandle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link DaytonaProviderAdapter} against a mocked Daytona API client.
 */
@ExtendWith(MockitoExtension.class)
class DaytonaProviderAdapterTest {

	private static final String WORK_DIR = "/home/daytona/workspace";

	@Mock
	private DaytonaApiClient apiClient;

	@Mock
	private PreviewProbe probe;

	private final List<String> output = new CopyOnWriteArrayList<>();

	private DaytonaProviderAdapter adapter;

	@BeforeEach
	void setUp() {
		adapter = new DaytonaProviderAdapter(DaytonaConfig.builder("test-key").build(), apiClient, probe);
	}

	@Test
	void createWaitsForStartedAndPreparesWorkspace() {
		SandboxHandle handle = create();

		@SuppressWarnings("unchecked")
		ArgumentCaptor<Map<String, String>> labels = ArgumentCaptor.forClass(Map.class);
		ArgumentCaptor<String> name = ArgumentCaptor.forClass(String.class);
		verify(apiClient).createSandbox(name.capture(), labels.capture());
		assertThat(name.getValue()).matches("p1-\\d+");
		assertThat(labels.getValue()).containsEntry("projectId", "p1").containsEntry("ownerId", "owner");
		verify(apiClient).waitForStarted("sbx1");
		verify(apiClient).executeCommand(eq("sbx1"), eq("mkdir -p '" + WORK_DIR + "'"), isNull(), any());
		assertThat(handle.id()).isEqualTo("sbx1");
		assertThat(output).contains("Daytona sandbox sbx1 is started");
	}

	@Test
	void createDeletesSandboxThatNeverStarts() {
		when(apiClient.createSandbox(anyString(), anyMap()))
			.thenReturn(new DaytonaApiClient.SandboxResponse("sbx1", "p1-1", "creating", null));
		doThrow(new SandboxException("Sandbox sbx1 failed to start: build_failed")).when(apiClient)
			.waitForStarted("sbx1");

		assertThatThrownBy(() -> adapter.create(SandboxConfig.of("p1", null, List.of()), (stream, line) -> {
		})).isInstanceOf(SandboxException.class).hasMessageContaining("build_failed");

		verify(apiClient).deleteSandbox("sbx1");
	}

	@Test
	void writeFilesCreatesParentDirectoriesAndVerifiesManifest() {
		SandboxHandle handle = create();
		when(apiClient.fileExists("sbx1", WORK_DIR + "/package.json")).thenReturn(true);

		adapter.writeFiles(handle,
				List.of(FileSpec.of("package.json", "{}"), FileSpec.of("app/(tabs)/index.tsx", "export default null;")));

		verify(apiClient).uploadFile("sbx1", WORK_DIR + "/package.json", "{}");
		verify(apiClient).executeCommand(eq("sbx1"), eq("mkdir -p '" + WORK_DIR + "/app/(tabs)'"), isNull(), any());
		verify(apiClient).uploadFile("sbx1", WORK_DIR + "/app/(tabs)/index.tsx", "export default null;");
	}

	@Test
	void writeFilesFailsWhenManifestIsMissingAfterUpload() {
		SandboxHandle handle = create();
		when(apiClient.fileExists("sbx1", WORK_DIR + "/package.json")).thenReturn(false);

		assertThatThrownBy(() -> adapter.writeFiles(handle, List.of(FileSpec.of("package.json", "{}"))))
			.isInstanceOf(SandboxException.class)
			.hasMessageContaining("package.json is missing");
	}

	@Test
	void failedMkdirFailsTheWrite() {
		SandboxHandle handle = create();
		when(apiClient.executeCommand(eq("sbx1"), eq("mkdir -p '" + WORK_DIR + "/src'"), isNull(), any()))
			.thenReturn(new DaytonaApiClient.ExecuteResponse(1, "mkdir: Permission denied"));

		assertThatThrownBy(() -> adapter.writeFiles(handle, List.of(FileSpec.of("src/App.tsx", "app"))))
			.isInstanceOf(SandboxException.class)
			.hasMessageContaining("Permission denied");
		verify(apiClient, never()).uploadFile(anyString(), anyString(), anyString());
	}

	@Test
	void installIsDeferredToServerStart() {
		SandboxHandle handle = create();

		assertThat(adapter.installDependencies(handle)).isEqualTo(InstallOutcome.DEFERRED);
	}

	@Test
	void startServerRunsPipelineInProjectSession() {
		SandboxHandle handle = create();
		when(apiClient.executeSessionCommand(eq("sbx1"), eq("preview-p1"), anyString(), eq(true)))
			.thenReturn(new DaytonaApiClient.SessionExecuteResponse("cmd-1", null, null));

		String endpoint = adapter.startServer(handle);

		verify(apiClient).createSession("sbx1", "preview-p1");
		ArgumentCaptor<String> command = ArgumentCaptor.forClass(String.class);
		verify(apiClient).executeSessionCommand(eq("sbx1"), eq("preview-p1"), command.capture(), eq(true));
		assertThat(command.getValue()).isEqualTo("(cd " + WORK_DIR + " && npm install --legacy-peer-deps && "
				+ "npx expo start --web --port 8081 > expo-web.log 2>&1) &");
		assertThat(endpoint).isEqualTo("http://localhost:8081");
	}

	@Test
	void sessionIdIsSafeForUrlPaths() {
		assertThat(DaytonaProviderAdapter.sessionIdFor("org/app 1")).isEqualTo("preview-org-app-1");
	}

	@Test
	void previewIsEmptyBeforeServerStart() {
		SandboxHandle handle = create();

		assertThat(adapter.getPreviewUrl(handle)).isEmpty();
		verify(apiClient, never()).getPreviewLink(anyString(), any(Integer.class));
		verifyNoInteractions(probe);
	}

	@Test
	void previewWaitsForProvisionedLinkAndServingServer() {
		SandboxHandle handle = started();
		when(apiClient.downloadFile("sbx1", WORK_DIR + "/expo-web.log")).thenReturn("",
				"Starting project\n", "Starting project\nWeb is waiting on http://localhost:8081\n");
		when(apiClient.getPreviewLink("sbx1", 8081)).thenReturn(new DaytonaApiClient.PreviewLink("initializing", null),
				new DaytonaApiClient.PreviewLink("https://8081-sbx1.proxy.daytona.work", "tok"));
		when(probe.isServing("https://8081-sbx1.proxy.daytona.work")).thenReturn(false, true);

		assertThat(adapter.getPreviewUrl(handle)).isEmpty();
		assertThat(adapter.getPreviewUrl(handle)).isEmpty();
		assertThat(adapter.getPreviewUrl(handle)).contains("https://8081-sbx1.proxy.daytona.work");

		assertThat(output).containsSubsequence("Starting project", "Web is waiting on http://localhost:8081");
		assertThat(output).filteredOn("Starting project"::equals).hasSize(1);
	}

	@Test
	void previewLinkErrorsPropagateToTheCaller() {
		SandboxHandle handle = started();
		when(apiClient.downloadFile(anyString(), anyString())).thenThrow(new SandboxException("Failed to read file"));
		when(apiClient.getPreviewLink("sbx1", 8081)).thenThrow(new SandboxException("Failed to get preview link: 500"));

		assertThatThrownBy(() -> adapter.getPreviewUrl(handle)).isInstanceOf(SandboxException.class)
			.hasMessageContaining("500");
	}

	@Test
	void destroyDeletesSandboxOnce() {
		SandboxHandle handle = create();

		adapter.destroy(handle);
		adapter.destroy(handle);

		verify(apiClient, times(1)).deleteSandbox("sbx1");
	}

	@Test
	void cloudPreviewsRequirePublicUrls() {
		assertThat(adapter.requiresPublicUrl()).isTrue();
		assertThat(adapter.name()).isEqualTo("daytona");
	}

	private SandboxHandle started() {
		SandboxHandle handle = create();
		when(apiClient.executeSessionCommand(anyString(), anyString(), anyString(), eq(true)))
			.thenReturn(new DaytonaApiClient.SessionExecuteResponse("cmd-1", null, null));
		adapter.startServer(handle);
		return handle;
	}

	private SandboxHandle create() {
		when(apiClient.createSandbox(anyString(), anyMap()))
			.thenReturn(new DaytonaApiClient.SandboxResponse("sbx1", "p1-1", "creating", null));
		when(apiClient.executeCommand(eq("sbx1"), anyString(), isNull(), any()))
			.thenReturn(new DaytonaApiClient.ExecuteResponse(0, ""));
		return adapter.create(SandboxConfig.of("p1", "owner", List.of()), (stream, line) -> output.add(line));
	}

}
