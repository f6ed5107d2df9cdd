package dev.poireviews.util;

import dev.poireviews.model.ReviewRecord;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.function.Consumer;

/** Summary statistics over a set of retrieved reviews */
public class StatisticsUtils {

	/**
	 * @param count number of reviews retrieved
	 * @param reportedTotal number of reviews the API said exist
	 * @param meanScore average of the numeric scores, empty if there are none
	 * @param totalUseful sum of the helpful votes
	 * @param meanUseful average helpful votes per review
	 */
	public record Statistics(
			int count,
			int reportedTotal,
			OptionalDouble meanScore,
			OptionalDouble minScore,
			OptionalDouble maxScore,
			long totalUseful,
			double meanUseful) {}

	private StatisticsUtils() {}

	public static Statistics compute(List<ReviewRecord> records, int reportedTotal) {
		double scoreSum = 0;
		int scored = 0;
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		long useful = 0;

		for (ReviewRecord record : records) {
			OptionalDouble score = numericScore(record.score());
			if (score.isPresent()) {
				double value = score.getAsDouble();
				scoreSum += value;
				scored++;
				min = Math.min(min, value);
				max = Math.max(max, value);
			}
			useful += record.usefulCount();
		}

		return new Statistics(
				records.size(),
				reportedTotal,
				scored > 0 ? OptionalDouble.of(scoreSum / scored) : OptionalDouble.empty(),
				scored > 0 ? OptionalDouble.of(min) : OptionalDouble.empty(),
				scored > 0 ? OptionalDouble.of(max) : OptionalDouble.empty(),
				useful,
				records.isEmpty() ? 0.0 : (double) useful / records.size());
	}

	/** Parse a score, or empty if it is blank or not a finite number */
	public static OptionalDouble numericScore(String score) {
		if (score == null || score.isBlank()) {
			return OptionalDouble.empty();
		}
		try {
			double value = Double.parseDouble(score.trim());
			return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
		} catch (NumberFormatException e) {
			return OptionalDouble.empty();
		}
	}

	/** Write the statistics as human readable lines */
	public static void describe(Statistics stats, Consumer<String> out) {
		out.accept("Reviews retrieved: " + stats.count());
		out.accept("Reviews reported by API: " + stats.reportedTotal());
		stats.meanScore().ifPresent(v -> out.accept(String.format(Locale.ROOT, "Average score: %.2f", v)));
		stats.maxScore().ifPresent(v -> out.accept(String.format(Locale.ROOT, "Highest score: %.2f", v)));
		stats.minScore().ifPresent(v -> out.accept(String.format(Locale.ROOT, "Lowest score: %.2f", v)));
		out.accept("Total helpful votes: " + stats.totalUseful());
		out.accept(String.format(Locale.ROOT, "Average helpful votes: %.2f", stats.meanUseful()));
	}
}
