package com.joshlong.portal.search.items;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;

/**
 * roles are hex encoded before they go into the index. Roles have to be compared
 * case-sensitively, and the search engine's keyword filters are used case-insensitively
 * by the portal's queries. {@link #ROLE_ADMIN} is left out entirely: admins skip the ACL
 * check anyway.
 */
public abstract class Acls {

	public static final String ROLE_ADMIN = "ROLE_ADMIN";

	private static final HexFormat HEX = HexFormat.of();

	public static List<String> encode(Collection<String> roles) {
		var encoded = new ArrayList<String>(roles.size());
		for (var role : roles)
			if (!ROLE_ADMIN.equals(role))
				encoded.add(encode(role));
		return encoded;
	}

	public static String encode(String role) {
		return HEX.formatHex(role.getBytes(StandardCharsets.UTF_8));
	}

}
