package org.springaicommunity.github.autoupdate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

/**
 * The single place where the {@link ObjectMapper} shared by the REST and GraphQL services
 * and the event router is configured.
 *
 * <p>
 * Record components are written in snake_case ({@code commitMessage} becomes
 * {@code commit_message} in a merge body) and null components are omitted, so an empty
 * merge message leaves the commit message to GitHub. Unknown properties in responses and
 * event payloads are ignored.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	public static ObjectMapper create() {
		return new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
			.setSerializationInclusion(JsonInclude.Include.NON_NULL)
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	}

}
