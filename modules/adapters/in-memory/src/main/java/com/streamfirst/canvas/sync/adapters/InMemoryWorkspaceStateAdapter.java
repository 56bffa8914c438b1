package com.streamfirst.canvas.sync.adapters;

import com.streamfirst.canvas.sync.domain.*;
import com.streamfirst.canvas.sync.ports.WorkspaceStatePort;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of WorkspaceStatePort standing in for the UI's state container. Counts
 * every applied change so tests can tell whether an update was applied once, twice or not at all.
 */
@Slf4j
public class InMemoryWorkspaceStateAdapter implements WorkspaceStatePort {

  private final AtomicLong revision = new AtomicLong();
  private volatile TabsPayload tabs;
  private volatile ExpandedItemsPayload expandedItems;
  private volatile LayoutPayload layout;
  private volatile SettingsPayload settings;
  private volatile PreferenceRecord preferences;

  @Override
  public void replaceTabs(TabsPayload tabs) {
    this.tabs = tabs;
    bump("tabs");
  }

  @Override
  public void replaceExpandedItems(ExpandedItemsPayload expandedItems) {
    this.expandedItems = expandedItems;
    bump("expanded items");
  }

  @Override
  public void replaceLayout(LayoutPayload layout) {
    this.layout = layout;
    bump("layout");
  }

  @Override
  public void replaceSettings(SettingsPayload settings) {
    this.settings = settings;
    bump("settings");
  }

  @Override
  public synchronized void mergePreferences(OwnerId ownerId, PreferencesUpdate update) {
    PreferenceRecord current = preferences != null ? preferences : PreferenceRecord.empty(ownerId);
    this.preferences = current.merge(update);
    bump("preferences");
  }

  @Override
  public Optional<TabsPayload> tabs() {
    return Optional.ofNullable(tabs);
  }

  @Override
  public Optional<ExpandedItemsPayload> expandedItems() {
    return Optional.ofNullable(expandedItems);
  }

  @Override
  public Optional<LayoutPayload> layout() {
    return Optional.ofNullable(layout);
  }

  @Override
  public Optional<SettingsPayload> settings() {
    return Optional.ofNullable(settings);
  }

  @Override
  public Optional<PreferenceRecord> preferences() {
    return Optional.ofNullable(preferences);
  }

  /** Number of changes applied since creation. */
  public long revision() {
    return revision.get();
  }

  private void bump(String what) {
    long current = revision.incrementAndGet();
    log.trace("Workspace state revision {} after {} change", current, what);
  }
}
