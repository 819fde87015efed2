package org.springaicommunity.github.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * A conversation comment on an issue or pull request, or a review comment attached to a
 * line of a pull request diff.
 *
 * @param id comment id
 * @param body comment text
 * @param author login of the author, null for deleted accounts
 * @param createdAt creation time (ISO-8601 text as returned by GitHub)
 * @param updatedAt last edit time
 * @param authorAssociation association of the author with the repository
 */
public record IssueComment(long id, @Nullable String body, @Nullable String author, @Nullable String createdAt,
		@Nullable String updatedAt, @Nullable String authorAssociation) {

	public static IssueComment from(JsonNode comment) {
		return new IssueComment(comment.path("id").asLong(), text(comment.path("body")),
				text(comment.path("user").path("login")), text(comment.path("created_at")),
				text(comment.path("updated_at")), text(comment.path("author_association")));
	}

	@Nullable
	private static String text(JsonNode node) {
		return node.isMissingNode() || node.isNull() ? null : node.asText();
	}

}
