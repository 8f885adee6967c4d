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

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a URL reported by a provider can be shown to the user.
 *
 * <p>
 * Providers hand out placeholder values while a preview is still being provisioned,
 * and some return a loopback address before the public route exists. Neither may ever
 * be reported as a ready preview.
 * </p>
 *
 * @since 0.1.0
 */
public final class PreviewUrls {

	private static final Set<String> PLACEHOLDERS = Set.of("", "initializing", "pending");

	private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "0.0.0.0", "[::1]", "::1");

	private PreviewUrls() {
	}

	/**
	 * Check whether {@code url} is a usable preview URL.
	 * @param url the candidate URL, may be {@code null}
	 * @param requirePublic whether loopback hosts must be rejected
	 * @return true if the URL is an absolute http(s) URL with a host, is not a
	 * placeholder, and satisfies the public-host requirement
	 */
	public static boolean isUsable(String url, boolean requirePublic) {
		if (url == null) {
			return false;
		}
		String candidate = url.trim();
		if (PLACEHOLDERS.contains(candidate.toLowerCase(Locale.ROOT))) {
			return false;
		}
		URI uri;
		try {
			uri = new URI(candidate);
		}
		catch (URISyntaxException e) {
			return false;
		}
		String scheme = uri.getScheme();
		if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
			return false;
		}
		String host = uri.getHost();
		if (host == null || host.isEmpty()) {
			return false;
		}
		return !requirePublic || !isLoopback(host);
	}

	static boolean isLoopback(String host) {
		String normalized = host.toLowerCase(Locale.ROOT);
		return LOOPBACK_HOSTS.contains(normalized) || normalized.endsWith(".localhost");
	}

}
