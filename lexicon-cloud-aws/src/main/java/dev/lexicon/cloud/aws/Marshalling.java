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

import static com.globalmentor.java.Conditions.*;
import static java.util.Objects.*;

import java.io.*;
import java.util.*;

import javax.annotation.*;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.exc.*;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import dev.lexicon.InMemoryGlossaryStore;
import io.clogr.Clogr;

/**
 * Shared definitions and common utilities for marshalling in AWS.
 * @apiNote While the American spelling is apparently "marshaling", the British spelling "marshalling" is more consistent with other doubled consonants when
 *          adding endings, and removes confusion over whether the second "a" is long or short.
 * @author The Lexicon Authors
 */
public class Marshalling {

	/** Original object mapper for internal conversions. */
	private static final ObjectMapper OBJECT_MAPPER;

	/** Reader for JSON deserialization. */
	public static final ObjectReader JSON_READER;

	/** Writer for JSON serialization. */
	public static final ObjectWriter JSON_WRITER;

	/** Type information for a JSON object with string keys. */
	private static final TypeReference<Map<String, Object>> JSON_OBJECT_TYPE = new TypeReference<>() {};

	/** Type information for a JSON object mapping terms to definitions. */
	private static final TypeReference<Map<String, String>> GLOSSARY_ENTRIES_TYPE = new TypeReference<>() {};

	/**
	 * Factory for creating an appropriately configured Jackson object mapper.
	 * @return A new instance of an object mapper, correctly configured for marshalling.
	 */
	private static ObjectMapper createJsonObjectMapper() {
		return JsonMapper.builder().serializationInclusion(JsonInclude.Include.NON_ABSENT) //
				.addModule(new Jdk8Module()) //
				.build();
	}

	static {
		OBJECT_MAPPER = createJsonObjectMapper();
		JSON_READER = OBJECT_MAPPER.reader();
		JSON_WRITER = OBJECT_MAPPER.writer();
	}

	/**
	 * Serializes some value for marshalling.
	 * @apiNote The returned output stream is useful for unit testing.
	 * @implNote If an {@code Optional<>} instance is given, its value will be extracted and marshalled, using <code>null</code> for
	 *           <code>Optional.empty()</code>.
	 * @param <OS> The type of output stream to write to.
	 * @param value The value to marshal.
	 * @param outputStream The output stream to which to write the value.
	 * @return The given output stream.
	 * @throws IOException If an I/O error occurs.
	 * @throws LexiconMarshalException If a data conversion or mapping exception occurs.
	 */
	public static <OS extends OutputStream> OS marshalJson(@Nullable final Object value, @Nonnull final OS outputStream) throws IOException {
		try {
			JSON_WRITER.writeValue(outputStream, value);
		} catch(final StreamWriteException | DatabindException jacksonException) {
			throw new LexiconMarshalException(jacksonException);
		}
		return outputStream;
	}

	/**
	 * Serializes some value to a JSON string.
	 * @apiNote This is the form used for the <code>body</code> of an HTTP-style response, which API Gateway expects to be a string rather than a nested object.
	 * @param value The value to marshal.
	 * @return The JSON serialization of the value.
	 * @throws LexiconMarshalException If a data conversion or mapping exception occurs.
	 */
	public static String toJson(@Nullable final Object value) {
		try {
			return JSON_WRITER.writeValueAsString(value);
		} catch(final JsonProcessingException jsonProcessingException) {
			throw new LexiconMarshalException("Unexpected error serializing JSON.", jsonProcessingException);
		}
	}

	/**
	 * Deserializes a JSON object, such as an invocation payload.
	 * @param inputStream The input stream from which to read the object.
	 * @return The properties of the object, in the order serialized.
	 * @throws IOException If an I/O error occurs.
	 * @throws LexiconMarshalException If the input is not valid JSON, or is not a JSON object.
	 */
	public static Map<String, Object> unmarshalJsonObject(@Nonnull final InputStream inputStream) throws IOException {
		final Map<String, Object> jsonObject;
		try {
			jsonObject = JSON_READER.forType(JSON_OBJECT_TYPE).readValue(inputStream);
		} catch(final JsonProcessingException jsonProcessingException) { //includes stream constraint violations such as excessive nesting
			throw new LexiconMarshalException("Error unmarshalling JSON object.", jsonProcessingException);
		}
		if(jsonObject == null) {
			throw new LexiconMarshalException("Expected JSON object; found `null`.");
		}
		return jsonObject;
	}

	/**
	 * Attempts to parse a string as a JSON object.
	 * @apiNote Unlike {@link #unmarshalJsonObject(InputStream)}, a failure to parse is not considered an error; this method is appropriate for leniently
	 *          inspecting content such as an HTTP request body which may or may not contain JSON.
	 * @param text The text to parse.
	 * @return The properties of the parsed object; or empty if the text is not valid JSON or does not represent a JSON object.
	 */
	public static Optional<Map<String, Object>> findJsonObject(@Nonnull final String text) {
		requireNonNull(text);
		try {
			return Optional.ofNullable(JSON_READER.forType(JSON_OBJECT_TYPE).readValue(text));
		} catch(final JsonProcessingException jsonProcessingException) {
			Clogr.getLogger(Marshalling.class).atDebug().log("Content is not a JSON object: {}", jsonProcessingException.getOriginalMessage());
			return Optional.empty();
		}
	}

	/**
	 * Deserializes a set of glossary entries from a JSON object mapping each term to its definition, such as
	 * <code>{"AWS KMS": "Key Management Service"}</code>.
	 * @param inputStream The input stream from which to read the entries.
	 * @return A glossary store containing the entries read.
	 * @throws IOException If an I/O error occurs.
	 * @throws LexiconMarshalException If the input is not a JSON object of string values.
	 * @throws IllegalArgumentException If an entry has an empty term or a <code>null</code> definition.
	 */
	public static InMemoryGlossaryStore unmarshalGlossaryEntries(@Nonnull final InputStream inputStream) throws IOException {
		final Map<String, String> definitionsByTerm;
		try {
			definitionsByTerm = JSON_READER.forType(GLOSSARY_ENTRIES_TYPE).readValue(inputStream);
		} catch(final JsonProcessingException jsonProcessingException) {
			throw new LexiconMarshalException("Error unmarshalling glossary entries.", jsonProcessingException);
		}
		if(definitionsByTerm == null) {
			throw new LexiconMarshalException("Expected JSON object of glossary entries; found `null`.");
		}
		definitionsByTerm.forEach((term, definition) -> checkArgument(!term.isEmpty() && definition != null, "Invalid glossary entry for term `%s`.", term));
		return new InMemoryGlossaryStore(definitionsByTerm);
	}

}
