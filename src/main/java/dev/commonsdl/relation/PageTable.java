package dev.commonsdl.relation;

import dev.commonsdl.model.Page;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** In-memory page relation, looked up by page id */
public class PageTable {
	private final Map<Long, Page> byId = new HashMap<>();

	public static PageTable empty() {
		return new PageTable();
	}

	public void add(Page page) {
		byId.put(page.id(), page);
	}

	public Optional<Page> get(long id) {
		return Optional.ofNullable(byId.get(id));
	}

	public int size() {
		return byId.size();
	}
}
