package com.streamfirst.canvas.sync.application;

import java.util.Set;

/**
 * Table and column names of the remote schema.
 */
public final class SyncTables {

    public static final String CANVAS_DATA = "user_canvas_data";
    public static final String PREFERENCES = "user_preferences";

    public static final String USER_ID = "user_id";
    public static final String DATA_TYPE = "data_type";
    public static final String DATA = "data";
    public static final String DEVICE_ID = "device_id";
    public static final String UPDATED_AT = "updated_at";

    public static final String LAYOUT_MODE = "layout_mode";
    public static final String NEW_TAB_BEHAVIOR = "new_tab_behavior";
    public static final String STARTUP_BEHAVIOR = "startup_behavior";
    public static final String GRID_MODE_STATE = "grid_mode_state";
    public static final String UI_SETTINGS = "ui_settings";

    /** One live canvas row per owner and data type */
    public static final Set<String> CANVAS_DATA_KEY = Set.of(USER_ID, DATA_TYPE);

    /** One live preferences row per owner */
    public static final Set<String> PREFERENCES_KEY = Set.of(USER_ID);

    private SyncTables() {
    }
}
