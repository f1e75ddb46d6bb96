package com.mosaic.imageStitching;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/** Append-only, in stitching order. */
public class StitchHistory implements Iterable<StitchRecord> {
    private final List<StitchRecord> records = new ArrayList<>();

    void append(StitchRecord record) {
        records.add(record);
    }

    public StitchRecord get(int index) {
        return records.get(index);
    }

    /** Most recent record, or null if nothing has been stitched yet. */
    public StitchRecord last() {
        return records.isEmpty() ? null : records.get(records.size() - 1);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public List<StitchRecord> asList() {
        return Collections.unmodifiableList(records);
    }

    @Override
    public Iterator<StitchRecord> iterator() {
        return asList().iterator();
    }
}
