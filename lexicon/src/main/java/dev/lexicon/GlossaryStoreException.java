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

import javax.annotation.*;

/**
 * Unchecked exception indicating that a glossary store could not complete a lookup, such as when the store is unreachable or a stored entry is malformed.
 * @apiNote A term that is merely absent from the store is not an error, and is not reported using this exception.
 * @author The Lexicon Authors
 */
public class GlossaryStoreException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	/** Constructor with no message. */
	public GlossaryStoreException() {
		this((String)null);
	}

	/**
	 * Message constructor.
	 * @param message An explanation of why the lookup failed, or <code>null</code> if no message should be used.
	 */
	public GlossaryStoreException(@Nullable final String message) {
		this(message, null);
	}

	/**
	 * Cause constructor. The message of the cause will be used if available.
	 * @param cause The cause error or <code>null</code> if the cause is nonexistent or unknown.
	 */
	public GlossaryStoreException(@Nullable final Throwable cause) {
		this(cause == null ? null : cause.toString(), cause);
	}

	/**
	 * Message and cause constructor.
	 * @param message An explanation of why the lookup failed, or <code>null</code> if no message should be used.
	 * @param cause The cause error or <code>null</code> if the cause is nonexistent or unknown.
	 */
	public GlossaryStoreException(@Nullable final String message, @Nullable final Throwable cause) {
		super(message, cause);
	}

}
