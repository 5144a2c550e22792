package com.mongodb.chunkplanner.model;

public enum DistributionMetric {
	COUNT("documents"),
	BYTES("bytes");

	private final String unit;

	DistributionMetric(String unit) {
		this.unit = unit;
	}

	public String getUnit() {
		return unit;
	}

	public static DistributionMetric fromString(String value) {
		for (DistributionMetric m : values()) {
			if (m.name().equalsIgnoreCase(value)) {
				return m;
			}
		}
		throw new IllegalArgumentException("Unknown distributionMetric '" + value + "', expecting count or bytes");
	}
}
