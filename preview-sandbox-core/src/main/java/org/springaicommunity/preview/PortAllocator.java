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

import java.util.BitSet;

/**
 * Hands out ports from a fixed range to local dev servers, lowest free port first.
 *
 * @since 0.1.0
 */
public final class PortAllocator {

	private final int basePort;

	private final int range;

	private final BitSet claimed;

	public PortAllocator(int basePort, int range) {
		if (basePort <= 0 || basePort + range > 65536 || range <= 0) {
			throw new IllegalArgumentException("Invalid port range " + basePort + " + " + range);
		}
		this.basePort = basePort;
		this.range = range;
		this.claimed = new BitSet(range);
	}

	/**
	 * Claim the lowest unclaimed port.
	 * @return the port
	 * @throws SandboxException if every port in the range is claimed
	 */
	public synchronized int claim() {
		int offset = claimed.nextClearBit(0);
		if (offset >= range) {
			throw new SandboxException(
					"No free port in range " + basePort + "-" + (basePort + range - 1) + " for a local dev server");
		}
		claimed.set(offset);
		return basePort + offset;
	}

	/**
	 * Return a port to the pool. Releasing an unclaimed port does nothing.
	 * @param port the port
	 */
	public synchronized void release(int port) {
		int offset = port - basePort;
		if (offset >= 0 && offset < range) {
			claimed.clear(offset);
		}
	}

	public synchronized boolean isClaimed(int port) {
		int offset = port - basePort;
		return offset >= 0 && offset < range && claimed.get(offset);
	}

	public synchronized int claimedCount() {
		return claimed.cardinality();
	}

}
