package com.joshlong.portal.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import org.jspecify.annotations.Nullable;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

public abstract class JdbcUtils {

	/**
	 * reads a one-dimensional {@code text[]} column. A {@code null} array is treated as
	 * empty. Anything with more dimensions means the schema doesn't look like we think it
	 * does, so we fail loudly.
	 */
	public static List<String> strings(ResultSet resultSet, String columnName) throws SQLException {
		var array = resultSet.getArray(columnName);
		if (array == null)
			return List.of();
		try {
			var values = (Object[]) array.getArray();
			var strings = new ArrayList<String>(values.length);
			for (var value : values) {
				if (value instanceof Object[])
					throw new IllegalStateException(
							"column '" + columnName + "' has more than one dimension, which is not supported");
				if (value != null)
					strings.add(value.toString());
			}
			return strings;
		} //
		finally {
			array.free();
		}
	}

	public static @Nullable OffsetDateTime offsetDateTime(ResultSet resultSet, String columnName)
			throws SQLException {
		return resultSet.getObject(columnName, OffsetDateTime.class);
	}

	public static @Nullable Long nullableLong(ResultSet resultSet, String columnName) throws SQLException {
		var value = resultSet.getLong(columnName);
		return resultSet.wasNull() ? null : value;
	}

	public static <T> List<T> json(ResultSet resultSet, String columnName,
			TypeReference<List<T>> typeReference) throws SQLException {
		var json = resultSet.getString(columnName);
		if (json == null)
			return List.of();
		return JsonUtils.read(json, typeReference);
	}

}
