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

import static dev.lexicon.Lexicon.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;

import java.util.Optional;

import org.junit.jupiter.api.*;

/**
 * Tests of {@link Lexicon}.
 * @author The Lexicon Authors
 */
public class LexiconTest {

	/** @return The table name expected when no system property is set, from the environment of the test run. */
	private static String expectedUnconfiguredTableName() {
		return Optional.ofNullable(System.getenv(ENV_TABLE_NAME)).filter(name -> !name.isBlank()).orElse(DEFAULT_TABLE_NAME);
	}

	@AfterEach
	void clearSystemProperties() {
		System.clearProperty(CONFIG_KEY_LEXICON_TABLE_NAME);
	}

	/** @see Lexicon#getTableName() */
	@Test
	void testGetTableNameFromSystemProperty() {
		System.setProperty(CONFIG_KEY_LEXICON_TABLE_NAME, "TestGlossary");
		assertThat(getTableName(), is("TestGlossary"));
	}

	/** Without the system property, only the table name environment variable or the default is used. */
	@Test
	void testGetTableNameUnconfigured() {
		assertThat(getTableName(), is(expectedUnconfiguredTableName()));
	}

	/** A blank configured table name is ignored. */
	@Test
	void testGetTableNameIgnoresBlank() {
		System.setProperty(CONFIG_KEY_LEXICON_TABLE_NAME, "  ");
		assertThat(getTableName(), is(expectedUnconfiguredTableName()));
	}

}
