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

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.springaicommunity.nicepath.PathValue;

/**
 * Jackson module that writes a {@link PathValue} as its canonical string.
 *
 * <p>
 * Paths are also supported as map keys, so a {@code Map<PathValue, ?>} survives a round
 * trip through JSON.
 * </p>
 *
 * <pre>{@code
 * ObjectMapper objectMapper = new ObjectMapper().registerModule(new PathValueModule());
 * String json = objectMapper.writeValueAsString(PathValue.parse("C:\\work\\src"));  // "C:/work/src"
 * }</pre>
 */
public class PathValueModule extends SimpleModule {

	public PathValueModule() {
		super(PathValueModule.class.getSimpleName());
		addSerializer(PathValue.class, new PathValueSerializer());
		addDeserializer(PathValue.class, new PathValueDeserializer());
		addKeySerializer(PathValue.class, new PathValueKeySerializer());
		addKeyDeserializer(PathValue.class, new PathValueKeyDeserializer());
	}

	static class PathValueSerializer extends StdSerializer<PathValue> {

		PathValueSerializer() {
			super(PathValue.class);
		}

		@Override
		public void serialize(PathValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
			gen.writeString(value.toString());
		}

	}

	static class PathValueKeySerializer extends StdSerializer<PathValue> {

		PathValueKeySerializer() {
			super(PathValue.class);
		}

		@Override
		public void serialize(PathValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
			gen.writeFieldName(value.toString());
		}

	}

	static class PathValueDeserializer extends StdDeserializer<PathValue> {

		PathValueDeserializer() {
			super(PathValue.class);
		}

		@Override
		public PathValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
			if (p.hasToken(JsonToken.VALUE_STRING)) {
				return PathValue.parse(p.getText());
			}
			return (PathValue) ctxt.handleUnexpectedToken(PathValue.class, p);
		}

	}

	static class PathValueKeyDeserializer extends KeyDeserializer {

		@Override
		public Object deserializeKey(String key, DeserializationContext ctxt) {
			return PathValue.parse(key);
		}

	}

}
