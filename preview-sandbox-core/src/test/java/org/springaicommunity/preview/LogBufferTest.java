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

import java.time.Instant;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LogBuffer}.
 */
class LogBufferTest {

	@Test
	void dropsOldestEntryWhenFull() {
		LogBuffer buffer = new LogBuffer(3);
		for (int i = 1; i <= 5; i++) {
			buffer.append(new LogEntry(Instant.EPOCH, LogStream.STDOUT, "line " + i));
		}

		assertThat(buffer.size()).isEqualTo(3);
		assertThat(buffer.snapshot()).extracting(LogEntry::message).containsExactly("line 3", "line 4", "line 5");
	}

	@Test
	void tailReturnsMostRecentEntriesOldestFirst() {
		LogBuffer buffer = new LogBuffer(10);
		for (int i = 1; i <= 4; i++) {
			buffer.append(new LogEntry(Instant.EPOCH, LogStream.INFO, "line " + i));
		}

		assertThat(buffer.tail(2)).extracting(LogEntry::message).containsExactly("line 3", "line 4");
		assertThat(buffer.tail(100)).hasSize(4);
	}

	@Test
	void rejectsNonPositiveCapacity() {
		assertThatThrownBy(() -> new LogBuffer(0)).isInstanceOf(IllegalArgumentException.class);
	}

}
