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

import static com.github.npathai.hamcrestopt.OptionalMatchers.*;
import static dev.lexicon.Lexicon.*;
import static dev.lexicon.cloud.aws.LexiconPlatformAws.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;

import org.junit.jupiter.api.*;

/**
 * Tests of {@link LexiconApplication}.
 * @author The Lexicon Authors
 */
public class LexiconApplicationTest {

	@AfterEach
	void clearConfiguration() {
		System.clearProperty(CONFIG_KEY_LEXICON_TABLE_NAME);
		System.clearProperty(CONFIG_KEY_AWS_PROFILE);
		System.clearProperty(CONFIG_KEY_AWS_REGION);
	}

	/** @see LexiconApplication#configureFromArgs(String[]) */
	@Test
	void testConfigureFromArgs() {
		LexiconApplication.configureFromArgs(new String[] {"--term", "AWS KMS", "--table", "TestTerms", "--aws-profile", "test", "--aws-region", "us-west-2"});
		assertThat(System.getProperty(CONFIG_KEY_LEXICON_TABLE_NAME), is("TestTerms"));
		assertThat(System.getProperty(CONFIG_KEY_AWS_PROFILE), is("test"));
		assertThat(System.getProperty(CONFIG_KEY_AWS_REGION), is("us-west-2"));
		assertThat(getTableName(), is("TestTerms"));
	}

	/** A trailing parameter without a value is ignored during configuration. */
	@Test
	void testConfigureFromArgsTrailingParameter() {
		LexiconApplication.configureFromArgs(new String[] {"--term", "AWS KMS", "--table"});
		assertThat(System.getProperty(CONFIG_KEY_LEXICON_TABLE_NAME), is(nullValue()));
	}

	/** @see LexiconApplication#findArgValue(String[], String) */
	@Test
	void testFindArgValue() {
		final String[] args = {"--term", "AWS KMS", "--entries", "entries.json"};
		assertThat(LexiconApplication.findArgValue(args, "--term"), isPresentAnd(is("AWS KMS")));
		assertThat(LexiconApplication.findArgValue(args, "--entries"), isPresentAnd(is("entries.json")));
		assertThat(LexiconApplication.findArgValue(args, "--payload"), isEmpty());
		assertThat(LexiconApplication.findArgValue(new String[0], "--term"), isEmpty());
		final IllegalArgumentException exception = Assertions.assertThrows(IllegalArgumentException.class,
				() -> LexiconApplication.findArgValue(new String[] {"--term"}, "--term"));
		assertThat(exception.getMessage(), is("Missing value for CLI parameter `--term`."));
	}

}
