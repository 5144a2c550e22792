package com.mongodb.chunkplanner.split;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

import org.bson.BsonString;
import org.bson.BsonValue;

import com.google.common.collect.ImmutableList;
import com.mongodb.chunkplanner.InvalidDomainException;

/**
 * An explicit set of string values (category names, region codes, ...) in ascending
 * order. Duplicates collapse.
 */
public class StringKeyDomain implements KeyDomain {

	private final List<String> values;

	public StringKeyDomain(Collection<String> values) {
		if (values == null || values.isEmpty()) {
			throw new InvalidDomainException("string domain has no values");
		}
		this.values = ImmutableList.copyOf(new TreeSet<>(values));
	}

	@Override
	public long size() {
		return values.size();
	}

	@Override
	public BsonValue valueAt(long index) {
		return new BsonString(values.get(Math.toIntExact(index)));
	}

	public List<String> getValues() {
		return values;
	}

	@Override
	public String toString() {
		return "StringKeyDomain" + values;
	}
}
