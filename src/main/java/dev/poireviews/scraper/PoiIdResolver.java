package dev.poireviews.scraper;

import dev.poireviews.util.HttpUtils;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up the POI id the comment API needs from an attraction page. The number in the page URL is
 * only the page id; the POI id is embedded in the page HTML.
 */
public class PoiIdResolver {
	private static final Logger logger = LoggerFactory.getLogger(PoiIdResolver.class);

	private static final Pattern PAGE_ID_PATTERN = Pattern.compile("/(\\d+)\\.html");
	private static final Pattern POI_ID_PATTERN = Pattern.compile("\"poiId\"\\s*:\\s*(\\d+)");

	private final HttpUtils httpUtils;

	public PoiIdResolver(HttpUtils httpUtils) {
		this.httpUtils = httpUtils;
	}

	/**
	 * Download the attraction page once and extract the POI id from it.
	 *
	 * @param pageUrl URL of the attraction page
	 * @return the POI id
	 * @throws ResolutionException if the page cannot be downloaded or contains no POI id
	 * @throws InterruptedException if interrupted while downloading
	 */
	public String resolve(String pageUrl) throws ResolutionException, InterruptedException {
		if (extractPageId(pageUrl) == null) {
			throw new ResolutionException("Not an attraction page URL: " + pageUrl);
		}

		logger.info("Resolving POI id from {}", pageUrl);
		String html;
		try {
			html = httpUtils.downloadString(pageUrl, headers());
		} catch (IOException | IllegalArgumentException e) {
			throw new ResolutionException("Failed to download " + pageUrl + ": " + e.getMessage(), e);
		}

		String poiId = extractPoiId(html);
		if (poiId == null) {
			throw new ResolutionException("No POI id found in " + pageUrl);
		}
		logger.info("Resolved POI id {}", poiId);
		return poiId;
	}

	/** Return the numeric page id of an attraction page URL, or null if the URL has none */
	public static String extractPageId(String url) {
		if (url == null) {
			return null;
		}
		Matcher matcher = PAGE_ID_PATTERN.matcher(url);
		return matcher.find() ? matcher.group(1) : null;
	}

	/** Return the first POI id embedded in page HTML, or null if there is none */
	public static String extractPoiId(String html) {
		Matcher matcher = POI_ID_PATTERN.matcher(html);
		return matcher.find() ? matcher.group(1) : null;
	}

	private static Map<String, String> headers() {
		Map<String, String> headers = new LinkedHashMap<>();
		headers.put("User-Agent", HttpUtils.USER_AGENT);
		headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8");
		headers.put("Accept-Language", "zh-CN,zh;q=0.9,en;q=0.8");
		return headers;
	}
}
