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

package org.springaicommunity.nicepath.jackson;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springaicommunity.nicepath.PathValue;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PathValueModule}.
 */
class PathValueModuleTest {

	private ObjectMapper objectMapper;

	@BeforeEach
	void setUp() {
		objectMapper = new ObjectMapper().registerModule(new PathValueModule());
	}

	record CopyJob(PathValue source, PathValue destination, List<PathValue> excludes) {
	}

	@Test
	void pathShouldSerializeAsCanonicalString() throws Exception {
		assertThat(objectMapper.writeValueAsString(PathValue.parse("C:\\work\\src\\"))).isEqualTo("\"C:/work/src\"");
		assertThat(objectMapper.writeValueAsString(PathValue.parse("a//b"))).isEqualTo("\"a/b\"");
	}

	@Test
	void pathShouldDeserializeFromString() throws Exception {
		PathValue path = objectMapper.readValue("\"/srv/data/\"", PathValue.class);

		assertThat(path).isEqualTo(PathValue.parse("/srv/data"));
		assertThat(path.isRelative()).isFalse();
	}

	@Test
	void pathFieldsShouldRoundTripInsideRecords() throws Exception {
		CopyJob job = new CopyJob(PathValue.parse("/src"), PathValue.parse("D:/backup"),
				List.of(PathValue.parse("build"), PathValue.parse("target/classes")));

		String json = objectMapper.writeValueAsString(job);
		CopyJob read = objectMapper.readValue(json, CopyJob.class);

		assertThat(json).contains("\"destination\":\"D:/backup\"");
		assertThat(read).isEqualTo(job);
		assertThat(read.excludes().get(1).isRelative()).isTrue();
	}

	@Test
	void pathShouldWorkAsMapKey() throws Exception {
		Map<PathValue, Integer> sizes = new TreeMap<>((a, b) -> a.toString().compareTo(b.toString()));
		sizes.put(PathValue.parse("/a/one.txt"), 1);
		sizes.put(PathValue.parse("/a/two.txt"), 2);

		String json = objectMapper.writeValueAsString(sizes);
		Map<PathValue, Integer> read = objectMapper.readValue(json, new TypeReference<Map<PathValue, Integer>>() {
		});

		assertThat(json).isEqualTo("{\"/a/one.txt\":1,\"/a/two.txt\":2}");
		assertThat(read).containsEntry(PathValue.parse("/a/one.txt"), 1).containsEntry(PathValue.parse("/a/two.txt"), 2);
	}

	@Test
	void nonStringTokenShouldBeRejected() {
		assertThatThrownBy(() -> objectMapper.readValue("42", PathValue.class))
			.isInstanceOf(MismatchedInputException.class);
	}

	@Test
	void nullShouldDeserializeAsNull() throws Exception {
		assertThat(objectMapper.readValue("null", PathValue.class)).isNull();
	}

}
