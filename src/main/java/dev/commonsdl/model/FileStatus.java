package dev.commonsdl.model;

public enum FileStatus {
	DOWNLOADED,
	PENDING,
	INVALID
}
