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

import javax.annotation.*;

/**
 * Unchecked exception indicating that a value could not be marshalled to or unmarshalled from its serialized form, such as a payload that is not valid JSON
 * or not of the expected structure.
 * @author The Lexicon Authors
 */
public class LexiconMarshalException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	/**
	 * Message constructor.
	 * @param message An explanation of the problem, or <code>null</code> if no message should be used.
	 */
	public LexiconMarshalException(@Nullable final String message) {
		this(message, null);
	}

	/**
	 * Cause constructor. The message of the cause will be used if available.
	 * @param cause The cause error or <code>null</code> if the cause is nonexistent or unknown.
	 */
	public LexiconMarshalException(@Nullable final Throwable cause) {
		this(cause == null ? null : cause.toString(), cause);
	}

	/**
	 * Message and cause constructor.
	 * @param message An explanation of the problem, or <code>null</code> if no message should be used.
	 * @param cause The cause error or <code>null</code> if the cause is nonexistent or unknown.
	 */
	public LexiconMarshalException(@Nullable final String message, @Nullable final Throwable cause) {
		super(message, cause);
	}

}
