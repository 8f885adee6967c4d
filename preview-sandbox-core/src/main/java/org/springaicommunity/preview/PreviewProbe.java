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

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-shot HTTP check that a dev server behind a provider's public route answers.
 *
 * <p>
 * Cloud gateways return 502/503/504 while nothing listens on the forwarded port; any
 * other status means the server is up, even if the root path itself is a 404.
 * </p>
 *
 * @since 0.1.0
 */
public class PreviewProbe {

	private static final Logger logger = LoggerFactory.getLogger(PreviewProbe.class);

	private static final Set<Integer> GATEWAY_NOT_READY = Set.of(502, 503, 504);

	private final HttpClient httpClient;

	private final Duration requestTimeout;

	public PreviewProbe() {
		this(Duration.ofSeconds(5));
	}

	public PreviewProbe(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(requestTimeout)
			.followRedirects(HttpClient.Redirect.NEVER)
			.build();
	}

	/**
	 * Probe the URL once.
	 * @param url the preview URL
	 * @return true if the dev server answered
	 */
	public boolean isServing(String url) {
		try {
			HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).GET().timeout(requestTimeout).build();
			HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
			if (GATEWAY_NOT_READY.contains(response.statusCode())) {
				logger.debug("Preview {} not serving yet ({})", url, response.statusCode());
				return false;
			}
			return true;
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			logger.debug("Preview {} not reachable: {}", url, e.getMessage());
			return false;
		}
	}

}
