package com.ecommercedata.sources;

import java.time.Instant;

/**
 * One social post matching a tracked keyword.
 *
 * @param platform   source platform, {@code reddit}
 * @param title      post title
 * @param content    post body, empty for link posts
 * @param score      engagement score
 * @param comments   number of comments
 * @param createdAt  post creation time
 * @param subreddit  community the post was made in
 * @param author     author name
 * @param url        absolute link to the post
 * @param keyword    search keyword that matched
 * @param capturedAt capture timestamp
 */
public record SocialMention(
    String platform,
    String title,
    String content,
    long score,
    long comments,
    Instant createdAt,
    String subreddit,
    String author,
    String url,
    String keyword,
    Instant capturedAt
) {
    public String naturalKey() {
        return url + "|" + keyword;
    }
}
