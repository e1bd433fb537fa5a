package com.joshlong.portal.search.text;

public enum TextAssetType {

	CAPTION,

	SLIDE_TEXT

}
