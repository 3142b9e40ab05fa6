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
import static java.util.Collections.*;

import java.util.*;

import javax.annotation.*;

/**
 * Typed, read-only view of an invocation payload as delivered to the function, either by an API Gateway proxy integration or by direct invocation.
 * <p>
 * The payload is inherently untyped; any of the recognized properties may be missing, <code>null</code>, or of an unexpected type. Each accessor returns a
 * value only if the property is present and of the expected type.
 * </p>
 * @author The Lexicon Authors
 * @see <a href="https://docs.aws.amazon.com/apigateway/latest/developerguide/set-up-lambda-proxy-integrations.html#api-gateway-simple-proxy-for-lambda-input-format">Input
 *      format of a Lambda function for proxy integration</a>
 */
public final class InvocationPayload {

	/** The payload property containing the mapping of query string parameters. */
	public static final String PROPERTY_QUERY_STRING_PARAMETERS = "queryStringParameters";

	/** The payload property containing the mapping of path parameters. */
	public static final String PROPERTY_PATH_PARAMETERS = "pathParameters";

	/** The payload property containing the request body, normally serialized as a string. */
	public static final String PROPERTY_BODY = "body";

	/** The payload property indicating whether the body string is Base64 encoded. */
	public static final String PROPERTY_IS_BASE64_ENCODED = "isBase64Encoded";

	/** The payload property containing the HTTP method of the request. */
	public static final String PROPERTY_HTTP_METHOD = "httpMethod";

	/** The property containing the term, whether at the top level of a direct invocation payload, as a parameter, or in a request body. */
	public static final String PROPERTY_TERM = "term";

	private final Map<String, Object> properties;

	/**
	 * Properties constructor. The map is copied, preserving its iteration order.
	 * @param properties The top-level properties of the payload, which may contain <code>null</code> values.
	 */
	public InvocationPayload(@Nonnull final Map<String, ?> properties) {
		this.properties = unmodifiableMap(new LinkedHashMap<>(properties));
	}

	/** @return The raw top-level properties of the payload. */
	public Map<String, Object> getProperties() {
		return properties;
	}

	/**
	 * Returns the names of the top-level properties.
	 * @apiNote The names are ordered by {@link String#compareTo(String)}, that is by UTF-16 code unit. A name containing a supplementary character (encoded
	 *          as a surrogate pair) thus sorts before a name beginning with a character in the range <code>U+E000</code> to <code>U+FFFF</code>, unlike an
	 *          ordering by code point.
	 * @return The top-level property names in sorted order.
	 */
	public SortedSet<String> getPropertyNames() {
		return unmodifiableSortedSet(new TreeSet<>(properties.keySet()));
	}

	/**
	 * Finds a top-level property value.
	 * @param propertyName The name of the property.
	 * @return The value of the property, which will not be present if the property is missing or <code>null</code>.
	 */
	public Optional<Object> findProperty(@Nonnull final String propertyName) {
		return Optional.ofNullable(properties.get(propertyName));
	}

	/** @return The query string parameters mapping, if present. */
	public Optional<Map<?, ?>> findQueryStringParameters() {
		return findMapProperty(PROPERTY_QUERY_STRING_PARAMETERS);
	}

	/** @return The path parameters mapping, if present. */
	public Optional<Map<?, ?>> findPathParameters() {
		return findMapProperty(PROPERTY_PATH_PARAMETERS);
	}

	/**
	 * Returns the request body.
	 * @apiNote A body delivered through API Gateway will be a string, but a direct invocation may supply the body as an already structured JSON object.
	 * @return The body, if present.
	 */
	public Optional<Object> findBody() {
		return findProperty(PROPERTY_BODY);
	}

	/** @return <code>true</code> if the payload indicates that its body string is Base64 encoded. */
	public boolean isBase64Encoded() {
		return findProperty(PROPERTY_IS_BASE64_ENCODED).flatMap(asInstance(Boolean.class)).orElse(false);
	}

	/** @return The HTTP method of the request, if present. */
	public Optional<String> findHttpMethod() {
		return findProperty(PROPERTY_HTTP_METHOD).flatMap(asInstance(String.class));
	}

	/** @return The value of the top-level term property, if present. */
	public Optional<Object> findTerm() {
		return findProperty(PROPERTY_TERM);
	}

	/**
	 * Finds a top-level property value that is a mapping.
	 * @param propertyName The name of the property.
	 * @return The mapping, which will not be present if the property is missing, <code>null</code>, or not a mapping.
	 */
	private Optional<Map<?, ?>> findMapProperty(@Nonnull final String propertyName) {
		return findProperty(propertyName).flatMap(asInstance(Map.class)).map(map -> (Map<?, ?>)map);
	}

	@Override
	public int hashCode() {
		return properties.hashCode();
	}

	@Override
	public boolean equals(final Object object) {
		if(this == object) {
			return true;
		}
		if(!(object instanceof InvocationPayload)) {
			return false;
		}
		return properties.equals(((InvocationPayload)object).properties);
	}

	@Override
	public String toString() {
		return properties.toString();
	}

}
