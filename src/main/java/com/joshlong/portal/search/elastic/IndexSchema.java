package com.joshlong.portal.search.elastic;

import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TypeMapping;
import com.joshlong.portal.search.IndexItemKind;

import java.util.Map;

/**
 * the mappings for our indexes. Only fields we search, filter or sort on are mapped
 * explicitly, everything else is left to dynamic mapping.
 */
abstract class IndexSchema {

	static TypeMapping mapping(IndexItemKind kind) {
		return switch (kind) {
			case EVENT -> TypeMapping.of(m -> m //
				.properties("title", text()) //
				.properties("description", text()) //
				.properties("series_title", text()) //
				.properties("creators", text()) //
				.properties("slide_texts", textSearchIndex()) //
				.properties("caption_texts", textSearchIndex()) //
				.properties("read_roles", keyword()) //
				.properties("write_roles", keyword()) //
				.properties("preview_roles", keyword()) //
				.properties("listed", bool()) //
				.properties("is_live", bool()) //
				.properties("created_timestamp", longValue()) //
				.properties("updated_timestamp", longValue()) //
				.properties("start_timestamp", longValue()) //
				.properties("end_timestamp", longValue()));
			case SERIES -> TypeMapping.of(m -> m //
				.properties("title", text()) //
				.properties("description", text()) //
				.properties("read_roles", keyword()) //
				.properties("write_roles", keyword()) //
				.properties("listed", bool()) //
				.properties("created_timestamp", longValue()) //
				.properties("updated_timestamp", longValue()) //
				.properties("thumbnails", disabled()));
			case REALM -> TypeMapping.of(m -> m //
				.properties("name", text()) //
				.properties("ancestor_names", text()) //
				.properties("full_path", keyword()));
			case USER -> TypeMapping.of(m -> m //
				.properties("display_name", text()) //
				.properties("username", keyword()) //
				.properties("user_role", keyword()) //
				.properties("email", keyword()));
			case PLAYLIST -> TypeMapping.of(m -> m //
				.properties("title", text()) //
				.properties("description", text()) //
				.properties("creator", text()) //
				.properties("read_roles", keyword()) //
				.properties("write_roles", keyword()) //
				.properties("listed", bool()) //
				.properties("updated_timestamp", longValue()));
		};
	}

	static TypeMapping metaMapping() {
		return TypeMapping.of(m -> m //
			.properties("version", Property.of(p -> p.integer(i -> i))) //
			.properties("dirty", bool()));
	}

	private static Property text() {
		return Property.of(p -> p.text(t -> t));
	}

	private static Property keyword() {
		return Property.of(p -> p.keyword(k -> k));
	}

	private static Property bool() {
		return Property.of(p -> p.boolean_(b -> b));
	}

	private static Property longValue() {
		return Property.of(p -> p.long_(l -> l));
	}

	private static Property disabled() {
		return Property.of(p -> p.object(o -> o.enabled(false)));
	}

	// the texts are searched, the timespan index is only ever read back
	private static Property textSearchIndex() {
		return Property.of(p -> p.object(o -> o.properties(Map.of( //
				"texts", text(), //
				"timespan_index", Property.of(ti -> ti.text(t -> t.index(false)))))));
	}

}
