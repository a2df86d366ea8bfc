package dev.commonsdl.model;

/** Namespace numbers of the media repository that the pipeline cares about */
public final class Namespace {
	public static final int FILE = 6;
	public static final int CATEGORY = 14;

	public static final String CATEGORY_PREFIX = "Category:";

	private Namespace() {}
}
