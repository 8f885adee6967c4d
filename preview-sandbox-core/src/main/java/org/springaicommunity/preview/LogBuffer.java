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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, thread-safe ring of log entries. Once full, appending drops the oldest entry.
 *
 * @since 0.1.0
 */
public final class LogBuffer {

	private final int capacity;

	private final Deque<LogEntry> entries;

	public LogBuffer(int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("Log capacity must be positive: " + capacity);
		}
		this.capacity = capacity;
		this.entries = new ArrayDeque<>(Math.min(capacity, 256));
	}

	public synchronized void append(LogEntry entry) {
		if (entries.size() == capacity) {
			entries.removeFirst();
		}
		entries.addLast(entry);
	}

	/**
	 * Get the most recent entries, oldest first.
	 * @param limit the maximum number of entries to return
	 * @return a copy of at most {@code limit} entries
	 */
	public synchronized List<LogEntry> tail(int limit) {
		int skip = Math.max(0, entries.size() - limit);
		List<LogEntry> result = new ArrayList<>(entries.size() - skip);
		int index = 0;
		for (LogEntry entry : entries) {
			if (index++ >= skip) {
				result.add(entry);
			}
		}
		return result;
	}

	public synchronized List<LogEntry> snapshot() {
		return new ArrayList<>(entries);
	}

	public synchronized int size() {
		return entries.size();
	}

	public int capacity() {
		return capacity;
	}

}
