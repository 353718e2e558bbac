package com.nova.fm.source;

import com.nova.fm.core.EntryChangeEvent;

@FunctionalInterface
public interface EntryChangeListener {

    void onEntryChange(EntryChangeEvent event);
}
