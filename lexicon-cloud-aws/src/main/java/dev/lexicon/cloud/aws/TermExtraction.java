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

import static com.globalmentor.java.Objects.*;
import static dev.lexicon.cloud.aws.InvocationPayload.*;
import static java.nio.charset.StandardCharsets.*;

import java.util.*;

import javax.annotation.*;

import io.clogr.Clogr;

/**
 * Extracts the search term from an invocation payload.
 * <p>
 * The term may appear in several locations depending on how the function was invoked. The locations are checked in the following order, and the first
 * non-empty string found is used:
 * </p>
 * <ol>
 * <li>The <code>term</code> query string parameter.</li>
 * <li>The <code>term</code> path parameter.</li>
 * <li>The <code>term</code> property of the request body parsed as a JSON object.</li>
 * <li>The top-level <code>term</code> property of a direct invocation payload.</li>
 * </ol>
 * @author The Lexicon Authors
 */
public final class TermExtraction {

	private TermExtraction() {
	}

	/**
	 * Extracts the term from an invocation payload.
	 * @param payload The invocation payload.
	 * @return The term, which will not be present if no location contains a non-empty string term.
	 */
	public static Optional<String> extractTerm(@Nonnull final InvocationPayload payload) {
		return findQueryStringParameterTerm(payload).or(() -> findPathParameterTerm(payload)).or(() -> findBodyTerm(payload))
				.or(() -> findInvocationTerm(payload));
	}

	/**
	 * Finds the term in the query string parameters.
	 * @param payload The invocation payload.
	 * @return The non-empty term, if present.
	 */
	static Optional<String> findQueryStringParameterTerm(@Nonnull final InvocationPayload payload) {
		return payload.findQueryStringParameters().flatMap(TermExtraction::findTermProperty);
	}

	/**
	 * Finds the term in the path parameters.
	 * @param payload The invocation payload.
	 * @return The non-empty term, if present.
	 */
	static Optional<String> findPathParameterTerm(@Nonnull final InvocationPayload payload) {
		return payload.findPathParameters().flatMap(TermExtraction::findTermProperty);
	}

	/**
	 * Finds the term in the request body.
	 * @implSpec A string body is decoded as necessary using {@link #decodeBody(String, boolean)} and then parsed using
	 *           {@link Marshalling#findJsonObject(String)}. A body that is already a mapping is used directly.
	 * @param payload The invocation payload.
	 * @return The non-empty term, if present; empty if there is no body, or if the body cannot be decoded or parsed.
	 */
	static Optional<String> findBodyTerm(@Nonnull final InvocationPayload payload) {
		return findBodyObject(payload).flatMap(TermExtraction::findTermProperty);
	}

	/**
	 * Finds the request body as a JSON object.
	 * @param payload The invocation payload.
	 * @return The properties of the body object; empty if there is no body, or if the body cannot be decoded or parsed as an object.
	 */
	static Optional<Map<?, ?>> findBodyObject(@Nonnull final InvocationPayload payload) {
		final Optional<Object> foundBody = payload.findBody();
		if(foundBody.isEmpty()) {
			return Optional.empty();
		}
		final Object body = foundBody.get();
		if(body instanceof Map<?, ?> bodyMap) {
			return Optional.of(bodyMap);
		}
		if(body instanceof String bodyString) {
			return decodeBody(bodyString, payload.isBase64Encoded()).flatMap(Marshalling::findJsonObject).map(bodyObject -> (Map<?, ?>)bodyObject);
		}
		return Optional.empty();
	}

	/**
	 * Finds the term at the top level of a direct invocation payload.
	 * @param payload The invocation payload.
	 * @return The non-empty term, if present.
	 */
	static Optional<String> findInvocationTerm(@Nonnull final InvocationPayload payload) {
		return payload.findTerm().flatMap(TermExtraction::asNonEmptyString);
	}

	/**
	 * Decodes a request body string.
	 * @param body The body as provided in the payload.
	 * @param isBase64Encoded Whether the body is Base64 encoded.
	 * @return The decoded body; empty if the body is Base64 encoded but could not be decoded.
	 */
	static Optional<String> decodeBody(@Nonnull final String body, final boolean isBase64Encoded) {
		if(!isBase64Encoded) {
			return Optional.of(body);
		}
		try {
			return Optional.of(new String(Base64.getDecoder().decode(body), UTF_8));
		} catch(final IllegalArgumentException illegalArgumentException) {
			Clogr.getLogger(TermExtraction.class).atDebug().log("Request body is not valid Base64: {}", illegalArgumentException.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Retrieves the {@value InvocationPayload#PROPERTY_TERM} property of a mapping.
	 * @param map The mapping such as the query string parameters or parsed body.
	 * @return The non-empty string term, if present.
	 */
	private static Optional<String> findTermProperty(@Nonnull final Map<?, ?> map) {
		return Optional.ofNullable(map.get(PROPERTY_TERM)).flatMap(TermExtraction::asNonEmptyString);
	}

	/**
	 * Returns a value as a term if it is a non-empty string.
	 * @param value The candidate value.
	 * @return The value as a string, which will not be present if the value is not a string or is the empty string.
	 */
	private static Optional<String> asNonEmptyString(@Nonnull final Object value) {
		return Optional.of(value).flatMap(asInstance(String.class)).filter(string -> !string.isEmpty());
	}

}
