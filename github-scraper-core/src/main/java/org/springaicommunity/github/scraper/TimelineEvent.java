package org.springaicommunity.github.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Flat view of one event on the timeline of an issue or pull request.
 *
 * <p>
 * GitHub reports the person behind an event as {@code actor}, {@code user} or, for
 * commits, a git {@code author}; this record always calls it {@code author}. Fields an
 * event type does not carry are {@code null}.
 *
 * @param event GitHub event name, such as {@code commented} or {@code cross-referenced}
 * @param kind coarse category: {@code comment}, {@code review}, {@code commit},
 * {@code label}, {@code assignment}, {@code close}, {@code merged}, {@code subscribed},
 * {@code issue} or {@code pull_request} (for cross references), empty for other events
 * @param author login, or git author name for {@code committed} events
 * @param email git author email of {@code committed} events
 * @param authorType account type of the author, such as {@code User} or {@code Bot}
 * @param authorAssociation association of the author with the repository
 * @param commitId commit SHA the event refers to
 * @param createdAt event time (ISO-8601 text as returned by GitHub)
 * @param sourceNumber number of the referencing issue or pull request
 * @param sourceRepository full name of the repository of the referencing issue
 * @param state review state, or state of the referencing issue
 * @param assignees logins assigned to the referencing issue
 * @param label label name of {@code labeled} events
 * @param body comment text of {@code commented} events
 */
public record TimelineEvent(String event, String kind, @Nullable String author, @Nullable String email,
		@Nullable String authorType, @Nullable String authorAssociation, @Nullable String commitId,
		@Nullable String createdAt, @Nullable Integer sourceNumber, @Nullable String sourceRepository,
		@Nullable String state, List<String> assignees, @Nullable String label, @Nullable String body) {

	public TimelineEvent {
		assignees = List.copyOf(assignees);
	}

	public static TimelineEvent from(JsonNode event) {
		String name = event.path("event").asText("");
		JsonNode actor = event.path("actor");
		String createdAt = text(event.path("created_at"));
		switch (name) {
			case "cross-referenced": {
				JsonNode issue = event.path("source").path("issue");
				List<String> assignees = new ArrayList<>();
				issue.path("assignees").forEach(assignee -> assignees.add(assignee.path("login").asText()));
				String kind = issue.has("pull_request") ? "pull_request" : "issue";
				Integer number = issue.path("number").isNumber() ? issue.path("number").asInt() : null;
				return new TimelineEvent(name, kind, text(actor.path("login")), null, text(actor.path("type")), null,
						null, createdAt, number, text(issue.path("repository").path("full_name")),
						text(issue.path("state")), assignees, null, null);
			}
			case "committed": {
				JsonNode gitAuthor = event.path("author");
				return new TimelineEvent(name, "commit", text(gitAuthor.path("name")), text(gitAuthor.path("email")),
						null, null, text(event.path("sha")), text(gitAuthor.path("date")), null, null, null, List.of(),
						null, null);
			}
			case "reviewed":
			case "commented": {
				JsonNode user = event.path("user");
				String kind = "reviewed".equals(name) ? "review" : "comment";
				// reviews carry submitted_at instead of created_at
				String when = createdAt != null ? createdAt : text(event.path("submitted_at"));
				return new TimelineEvent(name, kind, text(user.path("login")), null, text(user.path("type")),
						text(event.path("author_association")), null, when, null, null, text(event.path("state")),
						List.of(), null, text(event.path("body")));
			}
			default:
				return actorEvent(name, event, actor, createdAt);
		}
	}

	private static TimelineEvent actorEvent(String name, JsonNode event, JsonNode actor, @Nullable String createdAt) {
		String kind;
		switch (name) {
			case "referenced":
				kind = "commit";
				break;
			case "labeled":
				kind = "label";
				break;
			case "assigned":
				kind = "assignment";
				break;
			case "closed":
				kind = "close";
				break;
			case "merged":
			case "subscribed":
				kind = name;
				break;
			default:
				return new TimelineEvent(name, "", null, null, null, null, null, createdAt, null, null, null,
						List.of(), null, null);
		}
		return new TimelineEvent(name, kind, text(actor.path("login")), null, text(actor.path("type")), null,
				text(event.path("commit_id")), createdAt, null, null, null, List.of(),
				text(event.path("label").path("name")), null);
	}

	@Nullable
	private static String text(JsonNode node) {
		return node.isMissingNode() || node.isNull() ? null : node.asText();
	}

}
