package com.di.sqlpulse.api.dto;

import com.di.sqlpulse.collection.CollectionSettings;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SettingsResponse {
    boolean success;
    CollectionSettings settings;
    /** True when no settings are stored and defaults are shown. */
    boolean usingDefaults;
    String message;
}
