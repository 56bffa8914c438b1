package com.streamfirst.canvas.sync.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * The change-feed channels the workspace can observe, each bound to one backend table.
 */
public enum ChannelName {
    CANVAS_CHANGES("canvas-changes", "user_canvas_data", null),
    PREFERENCE_CHANGES("preference-changes", "user_preferences", null),
    SEARCH_HISTORY("search-history", "search_history", null),
    AI_CHAT("ai-chat", "ai_conversations", "conversation_id"),
    TOOLKIT_CHANGES("toolkit-changes", "user_toolkit", null),
    TRASH_CHANGES("trash-changes", "trash_bucket", null),
    SCENE_CHANGES("scene-changes", "scenes", "id"),
    PRESENTATION_CHANGES("presentation-changes", "presentations", "id"),
    MULTI_TAB_SYNC("multi-tab-sync", "multi_tab_sync", "session_id"),
    SOCIAL_EVENTS("social-events", "social_events", "group_id"),
    MESSAGE_DELIVERY("message-delivery", "message_delivery", "conversation_id");

    private final String wireName;
    private final String tableName;
    private final String subResourceColumn;

    ChannelName(String wireName, String tableName, String subResourceColumn) {
        this.wireName = wireName;
        this.tableName = tableName;
        this.subResourceColumn = subResourceColumn;
    }

    public String wireName() {
        return wireName;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Column a sub-resource id filters on. Channels without a natural sub-resource filter on
     * {@code resource_id}.
     */
    public String subResourceColumn() {
        return subResourceColumn != null ? subResourceColumn : "resource_id";
    }

    public static Optional<ChannelName> fromWireName(String wireName) {
        return Arrays.stream(values())
            .filter(name -> name.wireName.equals(wireName))
            .findFirst();
    }
}
