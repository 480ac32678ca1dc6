package com.flowo.live.core.channel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * =====================================================================
 * LiveChannels
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Canonical channel names used by the database triggers that feed the hub,
 * plus the validation rule every channel name must satisfy before it reaches
 * the upstream connection.
 *
 * CHANNEL FAMILIES
 * ----------------
 *   global_events                  every workflow/job change
 *   workflows_global_insert        newly inserted workflows
 *   workflow_events_<workflowId>   changes of a single workflow
 *   user_<userId>_events           changes owned by a single user
 *
 * NAME RULE
 * ---------
 *  - Must start with alphanumeric or underscore
 *  - May contain alphanumeric, underscore, hyphen, dot, colon
 *  - Max length: 63 chars (PostgreSQL identifier limit)
 *
 * The rule keeps names safe as quoted PostgreSQL identifiers and as NATS
 * subjects (no whitespace, no wildcards).
 */
public final class LiveChannels {

    public static final String GLOBAL_EVENTS = "global_events";
    public static final String WORKFLOWS_GLOBAL_INSERT = "workflows_global_insert";

    private static final String WORKFLOW_PREFIX = "workflow_events_";
    private static final String USER_PREFIX = "user_";
    private static final String USER_SUFFIX = "_events";

    private static final Pattern NAME = Pattern.compile("^[A-Za-z0-9_][A-Za-z0-9_.:-]{0,62}$");

    private LiveChannels() {
    }

    /** Channel carrying every change of one workflow. */
    public static String workflow(String workflowId) {
        return requireValid(WORKFLOW_PREFIX + requireId(workflowId, "workflowId"));
    }

    /**
     * Channels for a dashboard request: one per workflow id, plus the global insert
     * channel when requested. Blank ids are ignored, duplicates collapse, order is kept.
     */
    public static List<String> forRequest(Collection<String> workflowIds, boolean globalInsert) {
        Set<String> out = new LinkedHashSet<>();
        if (workflowIds != null) {
            for (String id : workflowIds) {
                if (id != null && !id.isBlank()) {
                    out.add(workflow(id.trim()));
                }
            }
        }
        if (globalInsert) {
            out.add(WORKFLOWS_GLOBAL_INSERT);
        }
        return new ArrayList<>(out);
    }

    public static boolean isValid(String channel) {
        return channel != null && NAME.matcher(channel).matches();
    }

    /**
     * @throws IllegalArgumentException if the name is not a valid channel
     */
    public static String requireValid(String channel) {
        if (!isValid(channel)) {
            throw new IllegalArgumentException("Invalid channel name: '" + channel + "'");
        }
        return channel;
    }

    /**
     * Whether the channel belongs to one of the families the triggers publish to.
     */
    public static boolean isKnownFamily(String channel) {
        if (!isValid(channel)) {
            return false;
        }
        if (GLOBAL_EVENTS.equals(channel) || WORKFLOWS_GLOBAL_INSERT.equals(channel)) {
            return true;
        }
        if (channel.startsWith(WORKFLOW_PREFIX)) {
            return channel.length() > WORKFLOW_PREFIX.length();
        }
        return channel.startsWith(USER_PREFIX)
                && channel.endsWith(USER_SUFFIX)
                && channel.length() > USER_PREFIX.length() + USER_SUFFIX.length();
    }

    private static String requireId(String id, String field) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return id;
    }
}
