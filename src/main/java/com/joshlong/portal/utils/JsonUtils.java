package com.joshlong.portal.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.Role;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * have Spring create an instance of this and we'll capture the {@link ObjectMapper om} in
 * a static variable. Until then (in plain unit tests, say) a default mapper is used.
 */
@Component
@Role(BeanDefinition.ROLE_INFRASTRUCTURE)
public class JsonUtils {

	private static final AtomicReference<ObjectMapper> OBJECT_MAPPER_ATOMIC_REFERENCE = new AtomicReference<>(
			new ObjectMapper().registerModule(new JavaTimeModule()));

	JsonUtils(ObjectMapper objectMapper) {
		OBJECT_MAPPER_ATOMIC_REFERENCE.set(objectMapper);
	}

	public static <T> T read(String json, TypeReference<T> typeReference) {
		try {
			return OBJECT_MAPPER_ATOMIC_REFERENCE.get().readValue(json, typeReference);
		} //
		catch (JsonProcessingException e) {
			throw new IllegalStateException("could not read JSON " + abbreviate(json), e);
		}
	}

	private static String abbreviate(String json) {
		return json == null || json.length() < 100 ? json : json.substring(0, 100) + "...";
	}

}
