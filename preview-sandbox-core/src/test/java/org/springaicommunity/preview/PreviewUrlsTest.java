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
package org.springaicommunity.preview;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PreviewUrls}.
 */
class PreviewUrlsTest {

	@Test
	void placeholdersAreNeverUsable() {
		assertThat(PreviewUrls.isUsable(null, false)).isFalse();
		assertThat(PreviewUrls.isUsable("", false)).isFalse();
		assertThat(PreviewUrls.isUsable("initializing", false)).isFalse();
		assertThat(PreviewUrls.isUsable("Pending", false)).isFalse();
	}

	@Test
	void requiresAbsoluteHttpUrlWithHost() {
		assertThat(PreviewUrls.isUsable("ftp://example.com", false)).isFalse();
		assertThat(PreviewUrls.isUsable("example.com/app", false)).isFalse();
		assertThat(PreviewUrls.isUsable("https://", false)).isFalse();
		assertThat(PreviewUrls.isUsable("http://exa mple.com", false)).isFalse();
		assertThat(PreviewUrls.isUsable("https://8081-abc.proxy.daytona.works", true)).isTrue();
	}

	@Test
	void loopbackRejectedOnlyWhenPublicUrlRequired() {
		assertThat(PreviewUrls.isUsable("http://localhost:8081", true)).isFalse();
		assertThat(PreviewUrls.isUsable("http://127.0.0.1:8081", true)).isFalse();
		assertThat(PreviewUrls.isUsable("http://0.0.0.0:8081", true)).isFalse();
		assertThat(PreviewUrls.isUsable("http://localhost:8081", false)).isTrue();
		assertThat(PreviewUrls.isUsable("http://192.168.1.20:8081", true)).isTrue();
	}

}
