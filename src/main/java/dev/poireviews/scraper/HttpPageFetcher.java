package dev.poireviews.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.poireviews.util.HttpUtils;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Fetches comment pages from the Ctrip comment API with a single POST per page */
public class HttpPageFetcher implements PageFetcher {
	public static final String COMMENT_API_URL =
			"https://m.ctrip.com/restapi/soa2/13444/json/getCommentCollapseList";

	private static final ObjectMapper objectMapper = new ObjectMapper();

	private final HttpUtils httpUtils;
	private final String apiUrl;

	public HttpPageFetcher(HttpUtils httpUtils) {
		this(httpUtils, COMMENT_API_URL);
	}

	public HttpPageFetcher(HttpUtils httpUtils, String apiUrl) {
		this.httpUtils = httpUtils;
		this.apiUrl = apiUrl;
	}

	@Override
	public PageResult fetch(PageRequest request) throws InterruptedException {
		HttpResponse<String> response;
		try {
			response = httpUtils.postJson(apiUrl, buildRequestBody(request), headers(request.poiId()));
		} catch (HttpTimeoutException e) {
			return PageResult.failure(FetchFailure.TIMEOUT, describe(e));
		} catch (ConnectException | UnknownHostException e) {
			return PageResult.failure(FetchFailure.CONNECTION, describe(e));
		} catch (IOException e) {
			if (e.getCause() instanceof UnresolvedAddressException) {
				return PageResult.failure(FetchFailure.CONNECTION, describe(e));
			}
			return PageResult.failure(FetchFailure.GENERIC_REQUEST, describe(e));
		}

		if (!HttpUtils.isSuccess(response.statusCode())) {
			return PageResult.httpError(response.statusCode());
		}
		return parseResponse(response.body());
	}

	/** Interpret a 2xx response body */
	static PageResult parseResponse(String body) {
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		} catch (JsonProcessingException e) {
			return PageResult.failure(FetchFailure.DECODE, e.getOriginalMessage());
		}
		if (root == null || root.isMissingNode()) {
			return PageResult.failure(FetchFailure.DECODE, "Empty response body");
		}

		JsonNode result = root.get("result");
		if (result == null || !result.isObject()) {
			return PageResult.failure(FetchFailure.MALFORMED_RESPONSE, "Response has no result envelope");
		}

		List<JsonNode> items = new ArrayList<>();
		JsonNode itemsNode = result.get("items");
		if (itemsNode != null && itemsNode.isArray()) {
			itemsNode.forEach(items::add);
		}
		int totalCount = result.path("totalCount").asInt(0);
		return PageResult.success(items, totalCount);
	}

	/** Build the JSON request body for a page */
	static String buildRequestBody(PageRequest request) {
		ObjectNode body = objectMapper.createObjectNode();

		ObjectNode arg = body.putObject("arg");
		arg.put("channelType", 2);
		arg.put("collapseType", 0);
		arg.put("commentTagId", 0);
		arg.put("pageIndex", request.pageIndex());
		arg.put("pageSize", request.pageSize());
		arg.put("poiId", Long.parseLong(request.poiId()));
		arg.put("sourceType", 3);
		arg.put("sortType", 1);
		arg.put("starType", 0);

		ObjectNode head = body.putObject("head");
		head.put("cid", "09031025312449459187");
		head.put("ctok", "");
		head.put("cver", "1.0");
		head.put("lang", "01");
		head.put("sid", "8888");
		head.put("syscode", "09");
		head.put("auth", "");
		head.put("xsid", "");
		head.putArray("extension");

		return body.toString();
	}

	static Map<String, String> headers(String poiId) {
		Map<String, String> headers = new LinkedHashMap<>();
		headers.put("User-Agent", HttpUtils.USER_AGENT);
		headers.put("Accept", "application/json, text/javascript, */*; q=0.01");
		headers.put("Accept-Language", "zh-CN,zh;q=0.9,en;q=0.8");
		headers.put("Origin", "https://you.ctrip.com");
		headers.put("Referer", "https://you.ctrip.com/sight/0/" + poiId + ".html");
		return headers;
	}

	private static String describe(Exception e) {
		return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
	}
}
