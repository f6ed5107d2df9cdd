package dev.poireviews.util;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVWriter;
import dev.poireviews.model.ReviewRecord;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Writes reviews as CSV, one row per review, in the column order declared on {@link ReviewRecord} */
public class CsvUtils {
	private static final ObjectMapper objectMapper = new ObjectMapper();
	private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {};
	private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

	// Lets spreadsheet applications detect UTF-8
	private static final char BOM = '\uFEFF';

	private CsvUtils() {}

	/** Default output file name for a POI, e.g. comments_25506_20240101_120000.csv */
	public static Path defaultOutputFile(String poiId, LocalDateTime now) {
		return Path.of("comments_" + poiId + "_" + TIMESTAMP.format(now) + ".csv");
	}

	/** Convert a review to its column values, in column order. Unset fields are left out. */
	public static Map<String, Object> toRow(ReviewRecord record) {
		return objectMapper.convertValue(record, ROW_TYPE);
	}

	/** The columns that at least one of the reviews has set, in column order */
	public static List<String> columns(List<ReviewRecord> records) {
		Set<String> present = new LinkedHashSet<>();
		for (ReviewRecord record : records) {
			present.addAll(toRow(record).keySet());
		}
		List<String> ordered = new ArrayList<>();
		for (String column : allColumns()) {
			if (present.contains(column)) {
				ordered.add(column);
			}
		}
		return ordered;
	}

	/**
	 * Write reviews to a CSV file, replacing it if it exists.
	 *
	 * @param file the file to write
	 * @param records the reviews, written in list order
	 * @throws IOException if the file cannot be written
	 */
	public static void writeReviews(Path file, List<ReviewRecord> records) throws IOException {
		if (records.isEmpty()) {
			throw new IllegalArgumentException("No reviews to write");
		}
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		List<String> columns = columns(records);
		try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
				CSVWriter writer = new CSVWriter(out)) {
			out.write(BOM);
			writer.writeNext(columns.toArray(String[]::new));
			for (ReviewRecord record : records) {
				Map<String, Object> row = toRow(record.withDefaults());
				String[] values = new String[columns.size()];
				for (int i = 0; i < values.length; i++) {
					Object value = row.get(columns.get(i));
					values[i] = value == null ? "" : value.toString();
				}
				writer.writeNext(values);
			}
		}
	}

	private static List<String> allColumns() {
		return List.of(ReviewRecord.class.getAnnotation(JsonPropertyOrder.class).value());
	}
}
