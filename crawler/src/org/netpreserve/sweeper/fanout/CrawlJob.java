package org.netpreserve.sweeper.fanout;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.Target;

/**
 * Request to crawl one target, as delivered by the job queue. The target is named by id or by username.
 *
 * @param workerId   worker the target is assigned to, informational
 * @param retryCount number of earlier attempts
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CrawlJob(
        @JsonProperty("target_id") @Nullable Long targetId,
        @JsonProperty("username") @Nullable String username,
        @JsonProperty("worker_id") @Nullable Long workerId,
        @JsonProperty("retry_count") int retryCount) {

    public CrawlJob {
        if (targetId == null && (username == null || username.isBlank())) {
            throw new IllegalArgumentException("Job needs a target_id or username");
        }
        if (retryCount < 0) throw new IllegalArgumentException("retry_count must not be negative");
    }

    public static CrawlJob forTarget(Target target) {
        return new CrawlJob(target.id(), target.username(), target.workerId(), 0);
    }

    public static CrawlJob forUsername(String username) {
        return new CrawlJob(null, username, null, 0);
    }

    public CrawlJob nextAttempt() {
        return new CrawlJob(targetId, username, workerId, retryCount + 1);
    }

    @Override
    public String toString() {
        return (targetId != null ? "#" + targetId : "@" + username) + (retryCount > 0 ? " (retry " + retryCount + ")" : "");
    }
}
