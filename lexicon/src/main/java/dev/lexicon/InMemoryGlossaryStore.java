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

package dev.lexicon;

import static com.globalmentor.java.Conditions.*;
import static java.util.Objects.*;

import java.util.*;
import java.util.stream.Stream;

import javax.annotation.*;

/**
 * Immutable glossary store keeping its entries in memory, useful for local runs and testing.
 * @author The Lexicon Authors
 */
public class InMemoryGlossaryStore implements GlossaryStore {

	private final Map<String, String> definitionsByTerm;

	/**
	 * Definitions map constructor. The map is copied.
	 * @param definitionsByTerm The definitions, keyed by term.
	 * @throws NullPointerException if the map or any of its keys or values is <code>null</code>.
	 */
	public InMemoryGlossaryStore(@Nonnull final Map<String, String> definitionsByTerm) {
		this.definitionsByTerm = Map.copyOf(definitionsByTerm);
	}

	/**
	 * Entries constructor.
	 * @param entries The glossary entries to store.
	 * @throws IllegalArgumentException if more than one entry has the same term.
	 */
	public InMemoryGlossaryStore(@Nonnull final DictionaryEntry... entries) {
		this(Stream.of(entries));
	}

	/**
	 * Entries stream constructor.
	 * @param entries The glossary entries to store.
	 * @throws IllegalArgumentException if more than one entry has the same term.
	 */
	public InMemoryGlossaryStore(@Nonnull final Stream<DictionaryEntry> entries) {
		final Map<String, String> definitionsByTerm = new HashMap<>();
		entries.forEach(entry -> {
			final String existingDefinition = definitionsByTerm.putIfAbsent(entry.term(), entry.definition());
			checkArgument(existingDefinition == null, "Duplicate glossary term `%s`.", entry.term());
		});
		this.definitionsByTerm = Map.copyOf(definitionsByTerm);
	}

	/** @return The number of entries in the store. */
	public int size() {
		return definitionsByTerm.size();
	}

	@Override
	public Optional<String> findDefinition(final String term) {
		return Optional.ofNullable(definitionsByTerm.get(requireNonNull(term)));
	}

}
