package com.mongodb.chunkplanner.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Namespace implements Comparable<Namespace> {

	private final static Pattern namespacePattern = Pattern.compile("^(.+?)\\.(.+)$");

	private final String databaseName;
	private final String collectionName;

	public Namespace(String ns) {
		Matcher m = namespacePattern.matcher(ns == null ? "" : ns);
		if (!m.find()) {
			throw new IllegalArgumentException("Invalid namespace '" + ns + "', expecting db.collection");
		}
		databaseName = m.group(1);
		collectionName = m.group(2);
	}

	public Namespace(String dbName, String collectionName) {
		this.databaseName = dbName;
		this.collectionName = collectionName;
	}

	public String getDatabaseName() {
		return databaseName;
	}

	public String getCollectionName() {
		return collectionName;
	}

	public String getNamespace() {
		return databaseName + "." + collectionName;
	}

	@Override
	public String toString() {
		return getNamespace();
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((collectionName == null) ? 0 : collectionName.hashCode());
		result = prime * result + ((databaseName == null) ? 0 : databaseName.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Namespace other = (Namespace) obj;
		return getNamespace().equals(other.getNamespace());
	}

	@Override
	public int compareTo(Namespace o) {
		return this.getNamespace().compareTo(o.getNamespace());
	}
}
