package com.mongodb.chunkplanner.util;

import org.apache.commons.lang3.StringUtils;

import com.mongodb.ConnectionString;

public class MaskUtil {

	public static String maskConnectionString(final ConnectionString cs) {
		return maskConnectionString(cs.getConnectionString());
	}

	public static String maskConnectionString(final String csStr) {
		if (csStr == null) {
			return null;
		}
		String after = StringUtils.substringAfter(csStr, "@");
		if (after == null || after.isEmpty()) {
			return csStr;
		}
		String before = StringUtils.substringBefore(csStr, "://");
		return before + "://" + "*****:*****@" + after;
	}
}
