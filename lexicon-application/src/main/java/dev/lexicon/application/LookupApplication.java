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

package dev.lexicon.application;

import static com.globalmentor.java.Conditions.*;
import static dev.lexicon.application.LexiconApplication.*;
import static dev.lexicon.cloud.aws.Marshalling.*;
import static java.nio.file.Files.*;
import static java.util.Objects.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

import javax.annotation.*;

import dev.lexicon.GlossaryStore;
import dev.lexicon.cloud.aws.*;
import io.clogr.Clogr;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Command-line program for invoking the glossary lookup handler locally, printing the resulting response envelope as JSON.
 * <p>
 * The payload is given either as a term using {@value #CLI_PARAM_TERM}, which is sent as a direct invocation payload; or as a complete invocation payload in a
 * JSON file using {@value #CLI_PARAM_PAYLOAD}. Entries are looked up in DynamoDB unless a JSON file of entries is given using {@value #CLI_PARAM_ENTRIES}.
 * </p>
 * @author The Lexicon Authors
 */
public class LookupApplication implements LexiconApplication {

	/** The CLI parameter providing a term to look up. */
	public static final String CLI_PARAM_TERM = "--term";

	/** The CLI parameter providing the path to a JSON file containing a complete invocation payload. */
	public static final String CLI_PARAM_PAYLOAD = "--payload";

	/** The CLI parameter providing the path to a JSON file mapping terms to definitions, to be used instead of DynamoDB. */
	public static final String CLI_PARAM_ENTRIES = "--entries";

	/** The exit code for a successful lookup. */
	public static final int EXIT_CODE_OK = 0;

	/** The exit code indicating a response other than success. */
	public static final int EXIT_CODE_LOOKUP_FAILED = 1;

	/** The exit code indicating invalid program arguments. */
	public static final int EXIT_CODE_USAGE = 2;

	/** The usage description. */
	static final String USAGE = "Usage: lookup (%s <term> | %s <payload.json>) [%s <entries.json>] [%s <table>] [%s <profile>] [%s <region>]".formatted(
			CLI_PARAM_TERM, CLI_PARAM_PAYLOAD, CLI_PARAM_ENTRIES, CLI_PARAM_TABLE, CLI_PARAM_AWS_PROFILE, CLI_PARAM_AWS_REGION);

	private final InvocationPayload payload;

	private final GlossaryLookupHandler handler;

	private final PrintStream out;

	@Nullable
	private ResponseEnvelope response = null;

	/** @return The response produced by the last run, if the application has been run. */
	public Optional<ResponseEnvelope> findResponse() {
		return Optional.ofNullable(response);
	}

	/**
	 * Constructor.
	 * @param payload The invocation payload to send to the handler.
	 * @param glossaryStore The store in which terms are looked up.
	 * @param out The destination for the serialized response.
	 */
	public LookupApplication(@Nonnull final InvocationPayload payload, @Nonnull final GlossaryStore glossaryStore, @Nonnull final PrintStream out) {
		this.payload = requireNonNull(payload);
		this.handler = new GlossaryLookupHandler(glossaryStore);
		this.out = requireNonNull(out);
	}

	@Override
	public void run() {
		final ResponseEnvelope response = handler.handle(payload);
		this.response = response;
		out.println(toJson(response));
	}

	/**
	 * {@inheritDoc}
	 * @implSpec This implementation returns {@value #EXIT_CODE_OK} if the response has a <code>2xx</code> status code, or {@value #EXIT_CODE_LOOKUP_FAILED}
	 *           otherwise.
	 */
	@Override
	public int start() {
		run();
		return response.statusCode() / 100 == 2 ? EXIT_CODE_OK : EXIT_CODE_LOOKUP_FAILED;
	}

	/**
	 * Creates an application from program arguments.
	 * @param args application arguments.
	 * @param out The destination for the serialized response.
	 * @return A new application configured from the arguments.
	 * @throws IllegalArgumentException if neither or both of {@value #CLI_PARAM_TERM} and {@value #CLI_PARAM_PAYLOAD} are given, or a parameter is missing
	 *           its value.
	 * @throws IOException if a payload or entries file could not be read.
	 * @throws LexiconMarshalException if a payload or entries file does not contain a valid JSON object.
	 */
	public static LookupApplication fromArgs(@Nonnull final String[] args, @Nonnull final PrintStream out) throws IOException {
		final Optional<String> foundTerm = findArgValue(args, CLI_PARAM_TERM);
		final Optional<Path> foundPayloadPath = findArgValue(args, CLI_PARAM_PAYLOAD).map(Paths::get);
		checkArgument(foundTerm.isPresent() != foundPayloadPath.isPresent(), "Exactly one of `%s` or `%s` must be given.", CLI_PARAM_TERM, CLI_PARAM_PAYLOAD);
		final InvocationPayload payload;
		if(foundTerm.isPresent()) {
			payload = new InvocationPayload(Map.of(InvocationPayload.PROPERTY_TERM, foundTerm.get()));
		} else {
			try (final InputStream inputStream = new BufferedInputStream(newInputStream(foundPayloadPath.get()))) {
				payload = new InvocationPayload(unmarshalJsonObject(inputStream));
			}
		}
		final Optional<Path> foundEntriesPath = findArgValue(args, CLI_PARAM_ENTRIES).map(Paths::get);
		final GlossaryStore glossaryStore;
		if(foundEntriesPath.isPresent()) {
			try (final InputStream inputStream = new BufferedInputStream(newInputStream(foundEntriesPath.get()))) {
				glossaryStore = unmarshalGlossaryEntries(inputStream);
			}
		} else {
			glossaryStore = DynamoDbGlossaryStore.create();
		}
		return new LookupApplication(payload, glossaryStore, out);
	}

	/**
	 * Main program entry point.
	 * @param args Program arguments.
	 */
	public static void main(final String[] args) {
		System.exit(execute(args, System.out, System.err));
	}

	/**
	 * Configures and runs the application, reporting problems rather than throwing them.
	 * @param args Program arguments.
	 * @param out The destination for the serialized response.
	 * @param err The destination for error messages.
	 * @return The exit code; {@value #EXIT_CODE_LOOKUP_FAILED} if a DynamoDB client could not be created.
	 */
	static int execute(@Nonnull final String[] args, @Nonnull final PrintStream out, @Nonnull final PrintStream err) {
		final LookupApplication application;
		try {
			LexiconApplication.configureFromArgs(args);
			application = fromArgs(args, out);
		} catch(final IllegalArgumentException illegalArgumentException) { //includes `LexiconMarshalException`
			err.println(illegalArgumentException.getMessage());
			err.println(USAGE);
			return EXIT_CODE_USAGE;
		} catch(final IOException ioException) {
			err.println("Unable to read file: " + ioException.getMessage());
			return EXIT_CODE_USAGE;
		} catch(final SdkException sdkException) {
			Clogr.getLogger(LookupApplication.class).atError().setCause(sdkException).log("Unable to access DynamoDB.");
			err.println("Unable to access DynamoDB: " + sdkException.getMessage());
			return EXIT_CODE_LOOKUP_FAILED;
		}
		return application.start();
	}

}
