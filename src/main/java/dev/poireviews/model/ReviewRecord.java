package dev.poireviews.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * A single user review, flattened into one tabular row. The property order is the column order
 * used when the reviews are written out.
 *
 * <p>A field the source item did not carry stays unset and is left out when serialized; its
 * accessor returns the field default instead.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
	"author",
	"date",
	"score",
	"content",
	"location",
	"tags",
	"useful_count",
	"reply_count",
	"image_count",
	"identity",
	"comment_id"
})
public class ReviewRecord {
	public static final String ANONYMOUS = "anonymous";

	@JsonProperty("author")
	private String author;

	@JsonProperty("date")
	private String date;

	@JsonProperty("score")
	private String score;

	@JsonProperty("content")
	private String content;

	@JsonProperty("location")
	private String location;

	@JsonProperty("tags")
	private String tags;

	@JsonProperty("useful_count")
	private Integer usefulCount;

	@JsonProperty("reply_count")
	private Integer replyCount;

	@JsonProperty("image_count")
	private Integer imageCount;

	@JsonProperty("identity")
	private String identity;

	@JsonProperty("comment_id")
	private String commentId;

	// Constructors
	public ReviewRecord() {}

	// Getters and Setters
	public String author() {
		return author != null ? author : ANONYMOUS;
	}

	public ReviewRecord author(String author) {
		this.author = author;
		return this;
	}

	public String date() {
		return date != null ? date : "";
	}

	public ReviewRecord date(String date) {
		this.date = date;
		return this;
	}

	public String score() {
		return score != null ? score : "";
	}

	public ReviewRecord score(String score) {
		this.score = score;
		return this;
	}

	public String content() {
		return content != null ? content : "";
	}

	public ReviewRecord content(String content) {
		this.content = content;
		return this;
	}

	public String location() {
		return location != null ? location : "";
	}

	public ReviewRecord location(String location) {
		this.location = location;
		return this;
	}

	public String tags() {
		return tags != null ? tags : "";
	}

	public ReviewRecord tags(String tags) {
		this.tags = tags;
		return this;
	}

	public int usefulCount() {
		return usefulCount != null ? usefulCount : 0;
	}

	public ReviewRecord usefulCount(Integer usefulCount) {
		this.usefulCount = usefulCount;
		return this;
	}

	public int replyCount() {
		return replyCount != null ? replyCount : 0;
	}

	public ReviewRecord replyCount(Integer replyCount) {
		this.replyCount = replyCount;
		return this;
	}

	public int imageCount() {
		return imageCount != null ? imageCount : 0;
	}

	public ReviewRecord imageCount(Integer imageCount) {
		this.imageCount = imageCount;
		return this;
	}

	public String identity() {
		return identity != null ? identity : "";
	}

	public ReviewRecord identity(String identity) {
		this.identity = identity;
		return this;
	}

	public String commentId() {
		return commentId != null ? commentId : "";
	}

	public ReviewRecord commentId(String commentId) {
		this.commentId = commentId;
		return this;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ReviewRecord that = (ReviewRecord) o;
		return Objects.equals(usefulCount, that.usefulCount)
				&& Objects.equals(replyCount, that.replyCount)
				&& Objects.equals(imageCount, that.imageCount)
				&& Objects.equals(author, that.author)
				&& Objects.equals(date, that.date)
				&& Objects.equals(score, that.score)
				&& Objects.equals(content, that.content)
				&& Objects.equals(location, that.location)
				&& Objects.equals(tags, that.tags)
				&& Objects.equals(identity, that.identity)
				&& Objects.equals(commentId, that.commentId);
	}

	@Override
	public int hashCode() {
		return Objects.hash(
				author, date, score, content, location, tags, usefulCount, replyCount, imageCount, identity, commentId);
	}

	@Override
	public String toString() {
		return "ReviewRecord[" + commentId() + " by " + author() + "]";
	}

	/** Copy of this review with every unset field filled with its default */
	public ReviewRecord withDefaults() {
		return create()
				.author(author())
				.date(date())
				.score(score())
				.content(content())
				.location(location())
				.tags(tags())
				.usefulCount(usefulCount())
				.replyCount(replyCount())
				.imageCount(imageCount())
				.identity(identity())
				.commentId(commentId());
	}

	public static ReviewRecord create() {
		return new ReviewRecord();
	}
}
