package dev.poireviews.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/** PageFetcher that plays back a fixed sequence of outcomes and records every request */
class ScriptedPageFetcher implements PageFetcher {
	private static final ObjectMapper objectMapper = new ObjectMapper();

	private final Deque<PageResult> script;
	private final List<PageRequest> requests = new ArrayList<>();
	private Runnable onFetch = () -> {};

	ScriptedPageFetcher(PageResult... results) {
		this.script = new ArrayDeque<>(Arrays.asList(results));
	}

	ScriptedPageFetcher onFetch(Runnable onFetch) {
		this.onFetch = onFetch;
		return this;
	}

	@Override
	public PageResult fetch(PageRequest request) {
		requests.add(request);
		onFetch.run();
		if (script.isEmpty()) {
			throw new AssertionError("Unexpected request for page " + request.pageIndex());
		}
		return script.poll();
	}

	List<PageRequest> getRequests() {
		return requests;
	}

	List<Integer> getRequestedPages() {
		return requests.stream().map(PageRequest::pageIndex).toList();
	}

	/** A page with {@code count} reviews whose ids start at {@code firstId} */
	static PageResult page(int firstId, int count, int total) {
		List<JsonNode> items = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			items.add(review(firstId + i));
		}
		return PageResult.success(items, total);
	}

	static PageResult empty(int total) {
		return PageResult.success(List.of(), total);
	}

	static ObjectNode review(int id) {
		ObjectNode item = objectMapper.createObjectNode();
		item.put("commentId", id);
		item.put("content", "Review " + id);
		item.put("score", 4 + (id % 2));
		item.put("usefulCount", id % 3);
		item.put("publishTypeTag", "2024-05-0" + (1 + id % 9) + " published");
		ObjectNode user = item.putObject("userInfo");
		user.put("userNick", "user" + id);
		return item;
	}
}
