package com.mongodb.chunkplanner.model;

public enum EntryStatus {
	PENDING,
	SPLIT_DONE,
	MOVED,
	FAILED
}
