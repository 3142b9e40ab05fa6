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

import static java.util.Objects.*;

import java.util.*;

import javax.annotation.*;

import dev.lexicon.*;
import io.clogr.Clogged;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

/**
 * Glossary store backed by an Amazon DynamoDB table.
 * <p>
 * Each item is keyed by a {@value #ATTRIBUTE_TERM} string partition key and carries its definition in a {@value #ATTRIBUTE_DEFINITION} string attribute.
 * </p>
 * @author The Lexicon Authors
 */
public class DynamoDbGlossaryStore implements GlossaryStore, Clogged {

	/** The name of the partition key attribute containing the term. */
	public static final String ATTRIBUTE_TERM = "term";

	/** The name of the attribute containing the definition. */
	public static final String ATTRIBUTE_DEFINITION = "definition";

	private final DynamoDbClient dynamoDbClient;

	/** @return The client for communicating with DynamoDB. */
	protected DynamoDbClient getDynamoDbClient() {
		return dynamoDbClient;
	}

	private final String tableName;

	/** @return The name of the table containing the glossary entries. */
	public String getTableName() {
		return tableName;
	}

	/**
	 * Client and table name constructor.
	 * @param dynamoDbClient The client for communicating with DynamoDB.
	 * @param tableName The name of the table containing the glossary entries.
	 */
	public DynamoDbGlossaryStore(@Nonnull final DynamoDbClient dynamoDbClient, @Nonnull final String tableName) {
		this.dynamoDbClient = requireNonNull(dynamoDbClient);
		this.tableName = requireNonNull(tableName);
	}

	/**
	 * Creates a store using a default DynamoDB client and the configured table name.
	 * @apiNote The default client determines the region and credentials from the environment, such as that provided by the AWS Lambda runtime.
	 * @return A new store for the configured table.
	 * @see Lexicon#getTableName()
	 */
	public static DynamoDbGlossaryStore create() {
		return new DynamoDbGlossaryStore(DynamoDbClient.create(), Lexicon.getTableName());
	}

	/**
	 * {@inheritDoc}
	 * @implSpec This implementation performs a single <code>GetItem</code> request with no retries beyond those performed by the SDK client itself.
	 * @throws GlossaryStoreException if DynamoDB could not be accessed, or if the item for the term has no string {@value #ATTRIBUTE_DEFINITION} attribute.
	 */
	@Override
	public Optional<String> findDefinition(final String term) {
		final GetItemRequest request = GetItemRequest.builder().tableName(getTableName()).key(Map.of(ATTRIBUTE_TERM, AttributeValue.fromS(requireNonNull(term))))
				.build();
		final GetItemResponse response;
		try {
			response = getDynamoDbClient().getItem(request);
		} catch(final SdkException sdkException) {
			throw new GlossaryStoreException("Unable to retrieve term `%s` from table `%s`: %s".formatted(term, getTableName(), sdkException.getMessage()),
					sdkException);
		}
		if(!response.hasItem() || response.item().isEmpty()) {
			getLogger().atDebug().log("Term `{}` not found in table `{}`.", term, getTableName());
			return Optional.empty();
		}
		final String definition = Optional.ofNullable(response.item().get(ATTRIBUTE_DEFINITION)).map(AttributeValue::s)
				.orElseThrow(() -> new GlossaryStoreException(
						"Item for term `%s` in table `%s` has no string `%s` attribute.".formatted(term, getTableName(), ATTRIBUTE_DEFINITION)));
		return Optional.of(definition);
	}

}
