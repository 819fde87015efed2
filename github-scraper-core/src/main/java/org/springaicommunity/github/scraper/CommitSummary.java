package org.springaicommunity.github.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Flat view of one commit of a pull request.
 *
 * @param sha commit SHA
 * @param author GitHub login of the author, if the commit is linked to an account
 * @param authorName author name from the commit
 * @param authorEmail author email from the commit
 * @param authoredDate author date (ISO-8601 text as returned by GitHub)
 * @param message commit message with newlines replaced by commas
 * @param committedDate committer date
 * @param parents parent SHAs, one per line
 * @param verified signature verification status, if reported
 */
public record CommitSummary(String sha, @Nullable String author, @Nullable String authorName,
		@Nullable String authorEmail, @Nullable String authoredDate, String message, @Nullable String committedDate,
		String parents, @Nullable Boolean verified) {

	public static CommitSummary from(JsonNode commit) {
		JsonNode details = commit.path("commit");
		JsonNode gitAuthor = details.path("author");

		List<String> parents = new ArrayList<>();
		commit.path("parents").forEach(parent -> parents.add(parent.path("sha").asText()));

		JsonNode verification = commit.has("verification") ? commit.path("verification")
				: details.path("verification");
		JsonNode verified = verification.path("verified");
		return new CommitSummary(commit.path("sha").asText(), text(commit.path("author").path("login")),
				text(gitAuthor.path("name")), text(gitAuthor.path("email")), text(gitAuthor.path("date")),
				details.path("message").asText("").replace("\n", ","), text(details.path("committer").path("date")),
				String.join("\n", parents), verified.isBoolean() ? verified.asBoolean() : null);
	}

	@Nullable
	private static String text(JsonNode node) {
		return node.isMissingNode() || node.isNull() ? null : node.asText();
	}

}
