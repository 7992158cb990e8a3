package com.scout.scheduler.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.scout.executor.ApprovalMode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored session for one conversation key.
 * <p>
 * {@code sessionId} is null for a placeholder that only carries an approval
 * mode chosen before any session existed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionKeyEntry {
    private String sessionId;
    /** UTC calendar day the entry was written, YYYY-MM-DD. */
    private String startedDate;
    private ApprovalMode permissionMode;
}
