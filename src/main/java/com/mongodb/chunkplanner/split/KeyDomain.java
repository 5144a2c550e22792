package com.mongodb.chunkplanner.split;

import org.bson.BsonValue;

/**
 * The ordered value space of the shard key's primary field.
 */
public interface KeyDomain {

	/**
	 * @return number of distinct representable values
	 */
	long size();

	/**
	 * @param index position in ascending order, 0 &lt;= index &lt; size()
	 */
	BsonValue valueAt(long index);
}
