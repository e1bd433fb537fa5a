package com.joshlong.portal.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.Array;
import java.sql.ResultSet;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JdbcUtilsTest {

	private final ResultSet resultSet = mock(ResultSet.class);

	@Test
	void strings() throws Exception {
		var array = mock(Array.class);
		when(array.getArray()).thenReturn(new String[] { "a", null, "b" });
		when(this.resultSet.getArray("roles")).thenReturn(array);
		Assertions.assertEquals(List.of("a", "b"), JdbcUtils.strings(this.resultSet, "roles"));
		verify(array).free();
		Assertions.assertEquals(List.of(), JdbcUtils.strings(this.resultSet, "missing"));
	}

	@Test
	void multiDimensionalArraysAreRejected() throws Exception {
		var array = mock(Array.class);
		when(array.getArray()).thenReturn(new Object[] { new Object[] { "a" } });
		when(this.resultSet.getArray("roles")).thenReturn(array);
		Assertions.assertThrows(IllegalStateException.class, () -> JdbcUtils.strings(this.resultSet, "roles"));
	}

	@Test
	void nullableLong() throws Exception {
		when(this.resultSet.getLong("series")).thenReturn(0L);
		when(this.resultSet.wasNull()).thenReturn(true);
		Assertions.assertNull(JdbcUtils.nullableLong(this.resultSet, "series"));
	}

	@Test
	void json() throws Exception {
		when(this.resultSet.getString("numbers")).thenReturn("[1, 2, 3]");
		Assertions.assertEquals(List.of(1, 2, 3),
				JdbcUtils.json(this.resultSet, "numbers", new TypeReference<List<Integer>>() {
				}));
		when(this.resultSet.getString("garbage")).thenReturn("{not json");
		Assertions.assertThrows(IllegalStateException.class,
				() -> JdbcUtils.json(this.resultSet, "garbage", new TypeReference<List<Integer>>() {
				}));
		Assertions.assertEquals(List.of(), JdbcUtils.json(this.resultSet, "null", new TypeReference<List<Integer>>() {
		}));
	}

}
