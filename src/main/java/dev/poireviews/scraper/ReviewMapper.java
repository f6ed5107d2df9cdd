package dev.poireviews.scraper;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import dev.poireviews.model.ReviewRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps raw review items from the comment API onto {@link ReviewRecord}s. Every field is described
 * by a {@link FieldMapping}; a field that cannot be read falls back to its default without
 * affecting the other fields of the review. Fields the item does not carry at all are left unset.
 */
public class ReviewMapper {
	private static final Logger logger = LoggerFactory.getLogger(ReviewMapper.class);

	/**
	 * One column of the review table: where the value lives in the raw item, the value to use when it
	 * is missing or unreadable, and how to convert the JSON node.
	 */
	public record FieldMapping<T>(
			String name,
			JsonPointer source,
			T defaultValue,
			Function<JsonNode, T> coercion,
			BiConsumer<ReviewRecord, T> target) {

		/** Extract this field from an item, degrading to the default on any problem */
		public T extract(JsonNode item) {
			JsonNode node = item.at(source);
			if (node.isMissingNode() || node.isNull()) {
				return defaultValue;
			}
			try {
				T value = coercion.apply(node);
				return value != null ? value : defaultValue;
			} catch (RuntimeException e) {
				logger.debug("Using default for field {}: {}", name, e.getMessage());
				return defaultValue;
			}
		}

		/** Whether the item carries this field at all, even as null */
		public boolean presentIn(JsonNode item) {
			return !item.at(source).isMissingNode();
		}

		void apply(JsonNode item, ReviewRecord record) {
			if (presentIn(item)) {
				target.accept(record, extract(item));
			}
		}
	}

	public static final FieldMapping<String> AUTHOR = new FieldMapping<>(
			"author", JsonPointer.compile("/userInfo/userNick"), ReviewRecord.ANONYMOUS, ReviewMapper::text,
			ReviewRecord::author);
	public static final FieldMapping<String> DATE = new FieldMapping<>(
			"date", JsonPointer.compile("/publishTypeTag"), "", ReviewMapper::firstToken, ReviewRecord::date);
	public static final FieldMapping<String> CONTENT = new FieldMapping<>(
			"content", JsonPointer.compile("/content"), "", ReviewMapper::text, ReviewRecord::content);
	public static final FieldMapping<String> LOCATION = new FieldMapping<>(
			"location", JsonPointer.compile("/ipLocatedName"), "", ReviewMapper::text, ReviewRecord::location);
	public static final FieldMapping<String> SCORE = new FieldMapping<>(
			"score", JsonPointer.compile("/score"), "", ReviewMapper::text, ReviewRecord::score);
	public static final FieldMapping<String> TAGS = new FieldMapping<>(
			"tags", JsonPointer.compile("/recommendItems"), "", ReviewMapper::joined, ReviewRecord::tags);
	public static final FieldMapping<Integer> USEFUL_COUNT = new FieldMapping<>(
			"useful_count", JsonPointer.compile("/usefulCount"), 0, ReviewMapper::count,
			ReviewRecord::usefulCount);
	public static final FieldMapping<String> COMMENT_ID = new FieldMapping<>(
			"comment_id", JsonPointer.compile("/commentId"), "", ReviewMapper::text, ReviewRecord::commentId);
	public static final FieldMapping<Integer> IMAGE_COUNT = new FieldMapping<>(
			"image_count", JsonPointer.compile("/images"), 0, ReviewMapper::size, ReviewRecord::imageCount);
	public static final FieldMapping<Integer> REPLY_COUNT = new FieldMapping<>(
			"reply_count", JsonPointer.compile("/replyCount"), 0, ReviewMapper::count, ReviewRecord::replyCount);
	public static final FieldMapping<String> IDENTITY = new FieldMapping<>(
			"identity", JsonPointer.compile("/userInfo/identitiesName"), "", ReviewMapper::text,
			ReviewRecord::identity);

	public static final List<FieldMapping<?>> FIELDS = List.of(
			AUTHOR, DATE, CONTENT, LOCATION, SCORE, TAGS, USEFUL_COUNT, COMMENT_ID, IMAGE_COUNT, REPLY_COUNT, IDENTITY);

	/**
	 * Map a single raw item.
	 *
	 * @param item the raw review item
	 * @return the mapped review
	 * @throws IllegalArgumentException if the item is not a JSON object
	 */
	public ReviewRecord map(JsonNode item) {
		if (item == null || !item.isObject()) {
			throw new IllegalArgumentException(
					"Review item is not an object: " + (item == null ? "null" : item.getNodeType()));
		}
		ReviewRecord record = ReviewRecord.create();
		for (FieldMapping<?> field : FIELDS) {
			field.apply(item, record);
		}
		return record;
	}

	/**
	 * Map all items of a page. Items that cannot be mapped at all are logged and skipped.
	 *
	 * @param items the raw items of one page
	 * @return the mapped reviews in page order
	 */
	public List<ReviewRecord> mapAll(List<JsonNode> items) {
		List<ReviewRecord> records = new ArrayList<>(items.size());
		for (JsonNode item : items) {
			try {
				records.add(map(item));
			} catch (RuntimeException e) {
				logger.warn("Skipping unreadable review item: {}", e.getMessage());
			}
		}
		return records;
	}

	static String text(JsonNode node) {
		if (!node.isValueNode()) {
			throw new FieldExtractionException("Expected a text value but got " + node.getNodeType());
		}
		return node.asText();
	}

	static String firstToken(JsonNode node) {
		String value = text(node).trim();
		if (value.isEmpty()) {
			return "";
		}
		return value.split("\\s+", 2)[0];
	}

	static String joined(JsonNode node) {
		if (!node.isArray()) {
			throw new FieldExtractionException("Expected an array but got " + node.getNodeType());
		}
		List<String> values = new ArrayList<>();
		for (JsonNode element : node) {
			values.add(text(element));
		}
		return String.join(",", values);
	}

	static Integer count(JsonNode node) {
		if (!node.canConvertToInt() && !node.isTextual()) {
			throw new FieldExtractionException("Expected a number but got " + node.getNodeType());
		}
		int value = node.isTextual() ? Integer.parseInt(node.asText().trim()) : node.asInt();
		if (value < 0) {
			throw new FieldExtractionException("Negative count " + value);
		}
		return value;
	}

	static Integer size(JsonNode node) {
		if (!node.isArray()) {
			throw new FieldExtractionException("Expected an array but got " + node.getNodeType());
		}
		return node.size();
	}
}
