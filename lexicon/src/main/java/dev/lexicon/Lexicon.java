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

/**
 * Lexicon is a glossary lookup service, resolving a term to its definition from a {@link GlossaryStore}.
 * <p>
 * The table name is looked up first as the Java system property {@value #CONFIG_KEY_LEXICON_TABLE_NAME}, and then as the environment variable
 * {@value #ENV_TABLE_NAME}. Blank values are ignored.
 * </p>
 * @author The Lexicon Authors
 */
public class Lexicon {

	/** The system property for the name of the table containing the glossary entries. */
	public static final String CONFIG_KEY_LEXICON_TABLE_NAME = "lexicon.table.name";

	/** The environment variable for the table name, as typically set in the function deployment template. */
	public static final String ENV_TABLE_NAME = "TABLE_NAME";

	/** The table name used if none is configured. */
	public static final String DEFAULT_TABLE_NAME = "GlossaryTerms";

	/**
	 * Determines the name of the table containing the glossary entries.
	 * @implSpec This implementation checks the {@value #CONFIG_KEY_LEXICON_TABLE_NAME} system property, followed by the {@value #ENV_TABLE_NAME} environment
	 *           variable, falling back to {@value #DEFAULT_TABLE_NAME}.
	 * @return The configured table name.
	 */
	public static String getTableName() {
		return Optional.ofNullable(System.getProperty(CONFIG_KEY_LEXICON_TABLE_NAME)).filter(name -> !name.isBlank())
				.or(() -> Optional.ofNullable(System.getenv(ENV_TABLE_NAME)).filter(name -> !name.isBlank())).orElse(DEFAULT_TABLE_NAME);
	}

}
