package com.streamfirst.canvas.sync.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelSpecTest {

    @Test
    void channelKeyIncludesOwnerAndSubResource() {
        OwnerId owner = new OwnerId("u1");

        assertThat(ChannelSpec.forOwner(ChannelName.CANVAS_CHANGES, owner).channelKey())
            .isEqualTo("canvas-changes:u1");
        assertThat(new ChannelSpec(ChannelName.PRESENTATION_CHANGES, owner, "p9").channelKey())
            .isEqualTo("presentation-changes:u1:p9");
        assertThat(new ChannelSpec(ChannelName.SOCIAL_EVENTS, null, "g1").channelKey())
            .isEqualTo("social-events:g1");
    }

    @Test
    void blankSubResourceIsDropped() {
        ChannelSpec spec = new ChannelSpec(ChannelName.SCENE_CHANGES, new OwnerId("u1"), "  ");

        assertThat(spec.subResourceId()).isEmpty();
        assertThat(spec.channelKey()).isEqualTo("scene-changes:u1");
    }

    @Test
    void channelsMapToTheirTables() {
        assertThat(ChannelName.CANVAS_CHANGES.tableName()).isEqualTo("user_canvas_data");
        assertThat(ChannelName.PREFERENCE_CHANGES.tableName()).isEqualTo("user_preferences");
        assertThat(ChannelName.AI_CHAT.subResourceColumn()).isEqualTo("conversation_id");
        assertThat(ChannelName.TRASH_CHANGES.subResourceColumn()).isEqualTo("resource_id");
        assertThat(ChannelName.fromWireName("multi-tab-sync")).contains(ChannelName.MULTI_TAB_SYNC);
        assertThat(DataType.fromWireName("expanded_items")).contains(DataType.EXPANDED_ITEMS);
        assertThat(DataType.fromWireName("unknown")).isEmpty();
    }

    @Test
    void ownerIdMustNotBeBlank() {
        assertThatThrownBy(() -> new OwnerId(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
