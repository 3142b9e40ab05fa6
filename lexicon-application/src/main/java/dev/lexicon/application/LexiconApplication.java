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
import static dev.lexicon.Lexicon.*;
import static dev.lexicon.cloud.aws.LexiconPlatformAws.*;

import java.util.Optional;

import javax.annotation.*;

import io.clogr.*;

/**
 * Convenience interface for a Lexicon application with CLI parameter configuration.
 * <p>
 * Subclasses should override {@link #run()} for program logic, but call {@link #start()} to actually begin execution of the application.
 * </p>
 * @author The Lexicon Authors
 */
public interface LexiconApplication extends Runnable, Clogged {

	/** The CLI parameter to set the name of the table containing the glossary entries. */
	public static final String CLI_PARAM_TABLE = "--table";

	/**
	 * The CLI parameter to set the AWS profile identifier.
	 * @see <a href="https://docs.aws.amazon.com/cli/latest/userguide/cli-configure-files.html#cli-configure-files-using-profiles">AWS Command Line Interface §
	 *      Configuration and credential file settings: Using named profiles</a>
	 */
	public static final String CLI_PARAM_AWS_PROFILE = "--aws-profile";

	/** The CLI parameter to set the AWS region. */
	public static final String CLI_PARAM_AWS_REGION = "--aws-region";

	/**
	 * Starts the application
	 * @implSpec The default implementation calls {@link #run()} and returns <code>0</code> as an exit code of "OK".
	 * @return The application status.
	 */
	public default int start() {
		run();
		return 0;
	}

	/**
	 * Configures Lexicon from application <code>main(…)</code> arguments.
	 * @implSpec This implementation supports the following CLI options:
	 *           <dl>
	 *           <dt>{@value #CLI_PARAM_TABLE}</dt>
	 *           <dd>Sets the system property {@value dev.lexicon.Lexicon#CONFIG_KEY_LEXICON_TABLE_NAME}.</dd>
	 *           <dt>{@value #CLI_PARAM_AWS_PROFILE}</dt>
	 *           <dd>Sets the system property {@value dev.lexicon.cloud.aws.LexiconPlatformAws#CONFIG_KEY_AWS_PROFILE}.</dd>
	 *           <dt>{@value #CLI_PARAM_AWS_REGION}</dt>
	 *           <dd>Sets the system property {@value dev.lexicon.cloud.aws.LexiconPlatformAws#CONFIG_KEY_AWS_REGION}.</dd>
	 *           </dl>
	 * @param args application arguments.
	 */
	public static void configureFromArgs(@Nonnull final String[] args) {
		for(int i = 0; i < args.length - 1; i++) {
			switch(args[i]) {
				case CLI_PARAM_TABLE -> {
					final String tableName = args[i + 1];
					System.setProperty(CONFIG_KEY_LEXICON_TABLE_NAME, tableName);
					Clogr.getLogger(LexiconApplication.class).atDebug().log("Using glossary table `{}`.", tableName);
				}
				case CLI_PARAM_AWS_PROFILE -> {
					final String awsProfile = args[i + 1];
					System.setProperty(CONFIG_KEY_AWS_PROFILE, awsProfile);
					Clogr.getLogger(LexiconApplication.class).atDebug().log("Using AWS profile `{}`.", awsProfile);
				}
				case CLI_PARAM_AWS_REGION -> {
					final String awsRegion = args[i + 1];
					System.setProperty(CONFIG_KEY_AWS_REGION, awsRegion);
					Clogr.getLogger(LexiconApplication.class).atDebug().log("Using AWS region `{}`.", awsRegion);
				}
			}
		}
	}

	/**
	 * Finds the value of a CLI option given as a parameter followed by its value.
	 * @param args application arguments.
	 * @param param The CLI parameter, such as {@value #CLI_PARAM_TABLE}.
	 * @return The value following the first occurrence of the parameter, if present.
	 * @throws IllegalArgumentException if the parameter is the last argument, with no value following it.
	 */
	public static Optional<String> findArgValue(@Nonnull final String[] args, @Nonnull final String param) {
		for(int i = 0; i < args.length; i++) {
			if(args[i].equals(param)) {
				checkArgument(i < args.length - 1, "Missing value for CLI parameter `%s`.", param);
				return Optional.of(args[i + 1]);
			}
		}
		return Optional.empty();
	}

}
