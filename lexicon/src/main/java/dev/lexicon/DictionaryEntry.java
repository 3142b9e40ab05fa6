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

import javax.annotation.*;

/**
 * A single glossary entry, associating a term with its definition.
 * @apiNote The term is used exactly as supplied; it is neither trimmed nor case-folded, so <code>"AWS KMS"</code> and <code>"aws kms"</code> are distinct
 *          entries.
 * @param term The term identifying the entry.
 * @param definition The definition of the term.
 */
public record DictionaryEntry(@Nonnull String term, @Nonnull String definition) {

	/**
	 * Validating constructor.
	 * @param term The term identifying the entry.
	 * @param definition The definition of the term.
	 * @throws NullPointerException if the term or definition is <code>null</code>.
	 * @throws IllegalArgumentException if the term is empty.
	 */
	public DictionaryEntry {
		requireNonNull(term);
		requireNonNull(definition);
		checkArgument(!term.isEmpty(), "Dictionary entry term cannot be empty.");
	}

}
