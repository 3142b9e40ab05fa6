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

/**
 * Definitions and utilities for running Lexicon on the AWS platform.
 * @author The Lexicon Authors
 * @see <a href="https://aws.amazon.com/">Amazon Web Services</a>
 */
public class LexiconPlatformAws {

	/**
	 * The configuration key for the AWS profile identifier.
	 * @apiNote The AWS <a href=
	 *          "https://sdk.amazonaws.com/java/api/latest/software/amazon/awssdk/auth/credentials/ProfileCredentialsProvider.html"><code>ProfileCredentialsProvider</code></a>
	 *          detects the profile either as the <code>AWS_PROFILE</code> environment variable or the <code>aws.profile</code> Java system property.
	 * @see <a href="https://docs.aws.amazon.com/sdk-for-java/latest/developer-guide/credentials-profiles.html">AWS SDK for Java 2.x § Use profiles</a>
	 */
	public static final String CONFIG_KEY_AWS_PROFILE = "aws.profile";

	/**
	 * The configuration key for the AWS region.
	 * @apiNote The AWS SDK default region provider chain checks the <code>aws.region</code> Java system property before the <code>AWS_REGION</code> environment
	 *          variable.
	 * @see <a href="https://docs.aws.amazon.com/sdk-for-java/latest/developer-guide/region-selection.html">AWS SDK for Java 2.x § Region selection</a>
	 */
	public static final String CONFIG_KEY_AWS_REGION = "aws.region";

}
