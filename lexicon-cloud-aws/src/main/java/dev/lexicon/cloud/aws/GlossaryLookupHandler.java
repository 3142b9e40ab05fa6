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
import static dev.lexicon.cloud.aws.TermExtraction.*;
import static java.util.Objects.*;

import java.io.*;
import java.util.*;

import javax.annotation.*;

import com.amazonaws.services.lambda.runtime.*;

import dev.lexicon.*;
import io.clogr.Clogged;

/**
 * AWS Lambda handler for looking up a glossary term.
 * <p>
 * The handler accepts an API Gateway proxy integration payload or a direct invocation payload, extracts the term using {@link TermExtraction}, looks it up in
 * the {@link GlossaryStore}, and returns a {@link ResponseEnvelope}. Every outcome, including an unexpected failure, is returned as a well-formed response;
 * the handler does not let a lookup failure escape to the Lambda runtime.
 * </p>
 * @author The Lexicon Authors
 */
public class GlossaryLookupHandler implements RequestStreamHandler, Clogged {

	private final GlossaryStore glossaryStore;

	/** @return The store in which terms are looked up. */
	protected GlossaryStore getGlossaryStore() {
		return glossaryStore;
	}

	/**
	 * No-args constructor used by the AWS Lambda runtime.
	 * @implSpec The glossary store is created using {@link DynamoDbGlossaryStore#create()}, and reused across invocations of this handler instance.
	 */
	public GlossaryLookupHandler() {
		this(DynamoDbGlossaryStore.create());
	}

	/**
	 * Glossary store constructor.
	 * @param glossaryStore The store in which terms are looked up.
	 */
	public GlossaryLookupHandler(@Nonnull final GlossaryStore glossaryStore) {
		this.glossaryStore = requireNonNull(glossaryStore);
	}

	/**
	 * {@inheritDoc}
	 * @implSpec This implementation unmarshals the payload as a JSON object, delegates to {@link #handle(InvocationPayload)}, and marshals the resulting
	 *           {@link ResponseEnvelope}. A payload that is not a JSON object results in a {@value ResponseEnvelope#STATUS_CODE_INTERNAL_SERVER_ERROR} response.
	 * @param inputStream The marshalled invocation payload.
	 * @param outputStream Receives the marshalled response envelope.
	 * @throws IOException if an I/O error occurs.
	 */
	@Override
	public void handleRequest(final InputStream inputStream, final OutputStream outputStream, @Nullable final Context context) throws IOException {
		if(context != null) {
			getLogger().atDebug().log("Handling AWS request `{}` for function `{}`.", context.getAwsRequestId(), context.getFunctionName());
		}
		ResponseEnvelope response;
		try {
			response = handle(new InvocationPayload(unmarshalJsonObject(new BufferedInputStream(inputStream))));
		} catch(final LexiconMarshalException marshalException) {
			getLogger().atError().setCause(marshalException).log("Unable to read invocation payload.");
			response = ResponseEnvelope.internalError(marshalException);
		}
		final BufferedOutputStream bufferedOutputStream = new BufferedOutputStream(outputStream);
		marshalJson(response, bufferedOutputStream).flush(); //be sure to flush after marshalling
	}

	/**
	 * Handles a lookup request.
	 * @implSpec This implementation logs the payload and extracted term, extracts the term using {@link TermExtraction#extractTerm(InvocationPayload)}, and
	 *           looks up an exact match in the glossary store. Any {@link RuntimeException} is converted to a
	 *           {@value ResponseEnvelope#STATUS_CODE_INTERNAL_SERVER_ERROR} response.
	 * @param payload The invocation payload.
	 * @return The response to return to the caller; never <code>null</code>.
	 */
	public ResponseEnvelope handle(@Nonnull final InvocationPayload payload) {
		getLogger().atInfo().log("Received invocation payload: {}", payload);
		try {
			final Optional<String> foundTerm = extractTerm(payload);
			getLogger().atInfo().log("Extracted term: `{}`", foundTerm.orElse(""));
			if(foundTerm.isEmpty()) {
				return ResponseEnvelope.badRequest(payload);
			}
			final String term = foundTerm.get();
			return getGlossaryStore().findEntry(term).map(ResponseEnvelope::ok).orElseGet(() -> ResponseEnvelope.notFound(term));
		} catch(final RuntimeException runtimeException) { //ignore low-level throwables such as `Error`, which are not meant to be caught
			getLogger().atError().setCause(runtimeException).log("Error looking up glossary term.");
			return ResponseEnvelope.internalError(runtimeException);
		}
	}

}
