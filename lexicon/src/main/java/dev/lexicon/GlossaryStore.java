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

import java.util.Optional;

import javax.annotation.*;

/**
 * Key-value store of glossary definitions, keyed by term.
 * @apiNote Implementations are expected to be safe for use by concurrent lookups, as a single store is typically shared across invocations.
 * @author The Lexicon Authors
 */
public interface GlossaryStore {

	/**
	 * Looks up the definition of a term. Only an exact match of the term is returned; no normalization is performed.
	 * @param term The term to look up.
	 * @return The definition of the term, which will not be present if the store has no entry for the term.
	 * @throws GlossaryStoreException if the store could not be reached or the stored entry is malformed.
	 */
	Optional<String> findDefinition(@Nonnull String term) throws GlossaryStoreException;

	/**
	 * Looks up the entry for a term.
	 * @implSpec The default implementation delegates to {@link #findDefinition(String)}.
	 * @param term The term to look up.
	 * @return The entry for the term, which will not be present if the store has no entry for the term.
	 * @throws GlossaryStoreException if the store could not be reached or the stored entry is malformed.
	 */
	default Optional<DictionaryEntry> findEntry(@Nonnull final String term) throws GlossaryStoreException {
		return findDefinition(term).map(definition -> new DictionaryEntry(term, definition));
	}

}
