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
import static java.net.HttpURLConnection.*;
import static java.util.Objects.*;

import java.util.*;

import javax.annotation.*;

import dev.lexicon.DictionaryEntry;

/**
 * HTTP-style response returned from the function, in the form expected by an API Gateway Lambda proxy integration.
 * @apiNote The body is a JSON document serialized as a string, not a nested object.
 * @param statusCode The HTTP status code.
 * @param headers The response headers.
 * @param body The serialized JSON response body.
 * @author The Lexicon Authors
 * @see <a href="https://docs.aws.amazon.com/apigateway/latest/developerguide/set-up-lambda-proxy-integrations.html#api-gateway-simple-proxy-for-lambda-output-format">Output
 *      format of a Lambda function for proxy integration</a>
 */
public record ResponseEnvelope(int statusCode, @Nonnull Map<String, String> headers, @Nonnull String body) {

	/** The HTTP status code of <code>200</code> for a term that was found. */
	public static final int STATUS_CODE_OK = HTTP_OK;

	/** The HTTP status code of <code>400</code> for a request missing a term. */
	public static final int STATUS_CODE_BAD_REQUEST = HTTP_BAD_REQUEST;

	/** The HTTP status code of <code>404</code> for a term not present in the glossary. */
	public static final int STATUS_CODE_NOT_FOUND = HTTP_NOT_FOUND;

	/** The HTTP status code of <code>500</code> for an unexpected error. */
	public static final int STATUS_CODE_INTERNAL_SERVER_ERROR = HTTP_INTERNAL_ERROR;

	/** The message given when no term was provided. */
	public static final String MESSAGE_TERM_REQUIRED = "Term parameter is required";

	/** The error given for an unexpected failure. */
	public static final String ERROR_INTERNAL_SERVER_ERROR = "Internal server error";

	/** The body property for the term of a found entry. */
	public static final String BODY_PROPERTY_TERM = "term";

	/** The body property for the definition of a found entry. */
	public static final String BODY_PROPERTY_DEFINITION = "definition";

	/** The body property for a human-readable message. */
	public static final String BODY_PROPERTY_MESSAGE = "message";

	/** The body property for diagnostic information about a bad request. */
	public static final String BODY_PROPERTY_DEBUG = "debug";

	/** The body property for the error category of a failure. */
	public static final String BODY_PROPERTY_ERROR = "error";

	/** The debug property listing the top-level payload property names, in sorted order. */
	public static final String DEBUG_PROPERTY_EVENT_KEYS = "event_keys";

	/**
	 * The headers included in every response, allowing unauthenticated calls from any browser origin.
	 * @apiNote The iteration order of these headers is stable.
	 */
	public static final Map<String, String> HEADERS;

	static {
		final Map<String, String> headers = new LinkedHashMap<>();
		headers.put("Content-Type", "application/json");
		headers.put("Access-Control-Allow-Origin", "*");
		headers.put("Access-Control-Allow-Methods", "OPTIONS,GET,POST");
		headers.put("Access-Control-Allow-Headers", "Content-Type");
		HEADERS = Collections.unmodifiableMap(headers);
	}

	/**
	 * Validating constructor.
	 * @param statusCode The HTTP status code.
	 * @param headers The response headers.
	 * @param body The serialized JSON response body.
	 */
	public ResponseEnvelope {
		requireNonNull(headers);
		requireNonNull(body);
	}

	/**
	 * Creates a response with the standard headers and the given body serialized as JSON.
	 * @param statusCode The HTTP status code.
	 * @param body The body to serialize.
	 * @return A new response.
	 * @throws LexiconMarshalException if the body cannot be serialized.
	 * @see #HEADERS
	 */
	public static ResponseEnvelope of(final int statusCode, @Nonnull final Map<String, ?> body) {
		return new ResponseEnvelope(statusCode, HEADERS, toJson(body));
	}

	/**
	 * Creates a response for a found glossary entry.
	 * @param entry The entry found.
	 * @return A <code>200</code> response containing the term and its definition.
	 */
	public static ResponseEnvelope ok(@Nonnull final DictionaryEntry entry) {
		final Map<String, Object> body = new LinkedHashMap<>();
		body.put(BODY_PROPERTY_TERM, entry.term());
		body.put(BODY_PROPERTY_DEFINITION, entry.definition());
		return of(STATUS_CODE_OK, body);
	}

	/**
	 * Creates a response for a request that did not contain a term.
	 * @apiNote The debug information echoes back only what the caller sent, to help diagnose where the term was expected.
	 * @param payload The invocation payload lacking a term.
	 * @return A <code>400</code> response with a message and debug information.
	 */
	public static ResponseEnvelope badRequest(@Nonnull final InvocationPayload payload) {
		final Map<String, Object> debug = new LinkedHashMap<>();
		debug.put(InvocationPayload.PROPERTY_QUERY_STRING_PARAMETERS, payload.findProperty(InvocationPayload.PROPERTY_QUERY_STRING_PARAMETERS).orElse(null));
		debug.put(InvocationPayload.PROPERTY_PATH_PARAMETERS, payload.findProperty(InvocationPayload.PROPERTY_PATH_PARAMETERS).orElse(null));
		debug.put(InvocationPayload.PROPERTY_BODY, payload.findBody().orElse(null));
		debug.put(InvocationPayload.PROPERTY_HTTP_METHOD, payload.findProperty(InvocationPayload.PROPERTY_HTTP_METHOD).orElse(null));
		debug.put(DEBUG_PROPERTY_EVENT_KEYS, List.copyOf(payload.getPropertyNames()));
		final Map<String, Object> body = new LinkedHashMap<>();
		body.put(BODY_PROPERTY_MESSAGE, MESSAGE_TERM_REQUIRED);
		body.put(BODY_PROPERTY_DEBUG, debug);
		return of(STATUS_CODE_BAD_REQUEST, body);
	}

	/**
	 * Creates a response for a term not present in the glossary.
	 * @param term The term that was not found.
	 * @return A <code>404</code> response with a message identifying the term.
	 */
	public static ResponseEnvelope notFound(@Nonnull final String term) {
		return of(STATUS_CODE_NOT_FOUND, Map.of(BODY_PROPERTY_MESSAGE, "Term \"%s\" not found".formatted(term)));
	}

	/**
	 * Creates a response for an unexpected failure.
	 * @implSpec The message is the message of the throwable, or its string form if it has no message.
	 * @param throwable The failure.
	 * @return A <code>500</code> response with a general error and the message of the failure.
	 */
	public static ResponseEnvelope internalError(@Nonnull final Throwable throwable) {
		final Map<String, Object> body = new LinkedHashMap<>();
		body.put(BODY_PROPERTY_ERROR, ERROR_INTERNAL_SERVER_ERROR);
		body.put(BODY_PROPERTY_MESSAGE, Optional.ofNullable(throwable.getMessage()).orElseGet(throwable::toString));
		return of(STATUS_CODE_INTERNAL_SERVER_ERROR, body);
	}

}
