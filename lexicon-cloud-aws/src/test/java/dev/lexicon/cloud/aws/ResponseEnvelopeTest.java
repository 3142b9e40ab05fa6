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

import static dev.lexicon.cloud.aws.Marshalling.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;

import java.io.IOException;
import java.util.*;

import org.junit.jupiter.api.*;

import dev.lexicon.DictionaryEntry;

/**
 * Tests of {@link ResponseEnvelope}.
 * @author The Lexicon Authors
 */
public class ResponseEnvelopeTest {

	@Test
	void testHeaders() {
		assertThat(ResponseEnvelope.HEADERS, is(Map.of("Content-Type", "application/json", "Access-Control-Allow-Origin", "*", "Access-Control-Allow-Methods",
				"OPTIONS,GET,POST", "Access-Control-Allow-Headers", "Content-Type")));
		Assertions.assertThrows(UnsupportedOperationException.class, () -> ResponseEnvelope.HEADERS.put("X-Foo", "bar"));
	}

	/** @see ResponseEnvelope#ok(DictionaryEntry) */
	@Test
	void testOk() {
		final ResponseEnvelope response = ResponseEnvelope.ok(new DictionaryEntry("AWS KMS", "Key Management Service"));
		assertThat(response.statusCode(), is(200));
		assertThat(response.headers(), is(ResponseEnvelope.HEADERS));
		assertThat(response.body(), is("{\"term\":\"AWS KMS\",\"definition\":\"Key Management Service\"}"));
	}

	/** @see ResponseEnvelope#notFound(String) */
	@Test
	void testNotFound() throws IOException {
		final ResponseEnvelope response = ResponseEnvelope.notFound("Nonexistent");
		assertThat(response.statusCode(), is(404));
		assertThat(response.headers(), is(ResponseEnvelope.HEADERS));
		assertThat(JSON_READER.readValue(response.body(), Map.class), is(Map.of("message", "Term \"Nonexistent\" not found")));
	}

	/** @see ResponseEnvelope#badRequest(InvocationPayload) */
	@Test
	void testBadRequest() throws IOException {
		final ResponseEnvelope response = ResponseEnvelope
				.badRequest(new InvocationPayload(Map.of("httpMethod", "GET", "queryStringParameters", Map.of("q", "AWS KMS"), "resource", "/lookup")));
		assertThat(response.statusCode(), is(400));
		assertThat(response.headers(), is(ResponseEnvelope.HEADERS));
		final Map<?, ?> body = JSON_READER.readValue(response.body(), Map.class);
		assertThat(body.get("message"), is("Term parameter is required"));
		final Map<?, ?> debug = (Map<?, ?>)body.get("debug");
		assertThat(debug.get("queryStringParameters"), is(Map.of("q", "AWS KMS")));
		assertThat(debug.get("httpMethod"), is("GET"));
		assertThat(debug.get("pathParameters"), is(nullValue()));
		assertThat(debug.get("body"), is(nullValue()));
		assertThat(debug.get("event_keys"), is(List.of("httpMethod", "queryStringParameters", "resource")));
	}

	/** @see ResponseEnvelope#internalError(Throwable) */
	@Test
	void testInternalError() throws IOException {
		final ResponseEnvelope response = ResponseEnvelope.internalError(new IllegalStateException("store unreachable"));
		assertThat(response.statusCode(), is(500));
		assertThat(response.headers(), is(ResponseEnvelope.HEADERS));
		assertThat(JSON_READER.readValue(response.body(), Map.class), is(Map.of("error", "Internal server error", "message", "store unreachable")));
	}

	/** A failure without a message is described by its string form. */
	@Test
	void testInternalErrorNoMessage() throws IOException {
		final ResponseEnvelope response = ResponseEnvelope.internalError(new UnsupportedOperationException());
		assertThat(JSON_READER.readValue(response.body(), Map.class).get("message"), is("java.lang.UnsupportedOperationException"));
	}

}
