package com.joshlong.portal.search;

/**
 * what the meta index tells us about the version of the search index.
 */
public record IndexState(Type type, int version, boolean dirty) {

	public enum Type {

		NO_VERSION_INFO,

		BROKEN_VERSION_INFO,

		INFO

	}

	public static IndexState noVersionInfo() {
		return new IndexState(Type.NO_VERSION_INFO, 0, false);
	}

	public static IndexState brokenVersionInfo() {
		return new IndexState(Type.BROKEN_VERSION_INFO, 0, false);
	}

	public static IndexState info(int version, boolean dirty) {
		return new IndexState(Type.INFO, version, dirty);
	}

	public boolean needsRebuild(int currentVersion) {
		return switch (this.type) {
			// indexes written before there was any meta info were on version 1
			case NO_VERSION_INFO -> currentVersion != 1;
			case BROKEN_VERSION_INFO -> true;
			case INFO -> this.dirty || this.version != currentVersion;
		};
	}

}
