/*
 * Copyright © 2026 The Lexicon Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.lexicon.cloud.aws;

import static com.github.npathai.hamcrestopt.OptionalMatchers.*;
import static dev.lexicon.cloud.aws.Marshalling.*;
import static java.nio.charset.StandardCharsets.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;

import java.io.*;
import java.util.*;

import org.junit.jupiter.api.*;

import com.fasterxml.jackson.databind.ObjectReader;

import dev.lexicon.InMemoryGlossaryStore;

/**
 * Tests of {@link Marshalling}.
 * @author The Lexicon Authors
 */
public class MarshallingTest {

	/** A test resource containing a JSON object mapping terms to definitions. */
	private static final String RESOURCE_GLOSSARY_ENTRIES = "glossary-entries.json";

	/**
	 * Sanity test to ensure that Jackson parses basic types to a map as expected.
	 * @see ObjectReader#readValue(String)
	 */
	@Test
	void testJacksonReadToMap() throws IOException {
		assertThat(JSON_READER.readValue("{\"foo\": [\"bar\", 123, true]}", Map.class), is(Map.of("foo", List.of("bar", 123, true))));
	}

	/**
	 * Test marshalling a value. Significantly confirms that {@link Optional} serialization occurs as expected.
	 * @see Marshalling#marshalJson(Object, OutputStream)
	 */
	@Test
	void testMarshalJson() throws IOException {
		assertThat(new String(Marshalling.marshalJson(null, new ByteArrayOutputStream()).toByteArray(), UTF_8), is("null"));
		assertThat(new String(Marshalling.marshalJson("foo", new ByteArrayOutputStream()).toByteArray(), UTF_8), is("\"foo\""));
		assertThat(new String(Marshalling.marshalJson(Optional.empty(), new ByteArrayOutputStream()).toByteArray(), UTF_8), is("null"));
		assertThat(new String(Marshalling.marshalJson(Optional.of("bar"), new ByteArrayOutputStream()).toByteArray(), UTF_8), is("\"bar\""));
	}

	/**
	 * The response envelope is marshalled with its body as a string rather than a nested object.
	 * @see Marshalling#toJson(Object)
	 */
	@Test
	void testToJsonResponseEnvelope() throws IOException {
		final String json = toJson(new ResponseEnvelope(200, Map.of("Content-Type", "application/json"), "{\"term\":\"foo\"}"));
		assertThat(JSON_READER.readValue(json, Map.class),
				is(Map.of("statusCode", 200, "headers", Map.of("Content-Type", "application/json"), "body", "{\"term\":\"foo\"}")));
	}

	/** @see Marshalling#unmarshalJsonObject(InputStream) */
	@Test
	void testUnmarshalJsonObject() throws IOException {
		final Map<String, Object> jsonObject = unmarshalJsonObject(
				new ByteArrayInputStream("{\"term\": \"AWS KMS\", \"queryStringParameters\": null}".getBytes(UTF_8)));
		assertThat(jsonObject.get("term"), is("AWS KMS"));
		assertThat("`null` property retained", jsonObject.containsKey("queryStringParameters"), is(true));
		assertThat(unmarshalJsonObject(new ByteArrayInputStream("{}".getBytes(UTF_8))), is(Map.of()));
	}

	/** @see Marshalling#unmarshalJsonObject(InputStream) */
	@Test
	void testUnmarshalJsonObjectInvalid() {
		Assertions.assertThrows(LexiconMarshalException.class, () -> unmarshalJsonObject(new ByteArrayInputStream("{not json".getBytes(UTF_8))), "invalid JSON");
		Assertions.assertThrows(LexiconMarshalException.class, () -> unmarshalJsonObject(new ByteArrayInputStream("[]".getBytes(UTF_8))), "array");
		Assertions.assertThrows(LexiconMarshalException.class, () -> unmarshalJsonObject(new ByteArrayInputStream("null".getBytes(UTF_8))), "null");
		Assertions.assertThrows(LexiconMarshalException.class, () -> unmarshalJsonObject(new ByteArrayInputStream(new byte[0])), "no content");
	}

	/**
	 * Input exceeding the parser stream constraints is reported the same as any other invalid input.
	 * @see Marshalling#unmarshalJsonObject(InputStream)
	 */
	@Test
	void testUnmarshalJsonObjectExcessiveNesting() {
		final String json = "{\"term\": \"AWS KMS\", \"x\": " + "[".repeat(1500) + "]".repeat(1500) + "}";
		Assertions.assertThrows(LexiconMarshalException.class, () -> unmarshalJsonObject(new ByteArrayInputStream(json.getBytes(UTF_8))));
	}

	/** @see Marshalling#findJsonObject(String) */
	@Test
	void testFindJsonObject() {
		assertThat(findJsonObject("{\"term\": \"AWS KMS\"}"), isPresentAnd(is(Map.of("term", "AWS KMS"))));
		assertThat(findJsonObject("{}"), isPresentAnd(is(Map.of())));
		assertThat("invalid JSON", findJsonObject("{not json"), isEmpty());
		assertThat("array", findJsonObject("[1, 2]"), isEmpty());
		assertThat("string", findJsonObject("\"term\""), isEmpty());
		assertThat("null", findJsonObject("null"), isEmpty());
		assertThat("empty", findJsonObject(""), isEmpty());
	}

	/** @see Marshalling#unmarshalGlossaryEntries(InputStream) */
	@Test
	void testUnmarshalGlossaryEntries() throws IOException {
		final InMemoryGlossaryStore store;
		try (final InputStream inputStream = getClass().getResourceAsStream(RESOURCE_GLOSSARY_ENTRIES)) {
			store = unmarshalGlossaryEntries(inputStream);
		}
		assertThat(store.size(), is(3));
		assertThat(store.findDefinition("AWS KMS"), isPresentAnd(is("Key Management Service")));
		assertThat(store.findDefinition("Amazon S3"), isPresentAnd(is("Simple Storage Service")));
		assertThat(store.findDefinition("AWS Lambda"), isPresentAnd(is("Serverless compute service that runs code in response to events")));
		assertThat(store.findDefinition("aws kms"), isEmpty());
	}

	/** @see Marshalling#unmarshalGlossaryEntries(InputStream) */
	@Test
	void testUnmarshalGlossaryEntriesInvalid() {
		Assertions.assertThrows(LexiconMarshalException.class, () -> unmarshalGlossaryEntries(new ByteArrayInputStream("[]".getBytes(UTF_8))), "array");
		final IllegalArgumentException emptyTermException = Assertions.assertThrows(IllegalArgumentException.class,
				() -> unmarshalGlossaryEntries(new ByteArrayInputStream("{\"\": \"definition\"}".getBytes(UTF_8))), "empty term");
		assertThat(emptyTermException.getMessage(), is("Invalid glossary entry for term ``."));
		final IllegalArgumentException missingDefinitionException = Assertions.assertThrows(IllegalArgumentException.class,
				() -> unmarshalGlossaryEntries(new ByteArrayInputStream("{\"term\": null}".getBytes(UTF_8))), "missing definition");
		assertThat(missingDefinitionException.getMessage(), is("Invalid glossary entry for term `term`."));
	}

}
