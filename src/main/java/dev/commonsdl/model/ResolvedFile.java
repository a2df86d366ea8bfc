package dev.commonsdl.model;

/** A media file title that belongs to one of the requested categories */
public record ResolvedFile(String title, String discoveredViaCategory) {}
