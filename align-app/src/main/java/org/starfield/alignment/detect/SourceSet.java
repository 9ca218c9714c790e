package org.starfield.alignment.detect;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, unmodifiable collection of the sources detected in one frame.
 */
public class SourceSet
        implements Iterable<Source>, Serializable {

    private final int frameIndex;
    private final List<Source> sources;

    public SourceSet(final int frameIndex,
                     final List<Source> sources) {
        this.frameIndex = frameIndex;
        this.sources = Collections.unmodifiableList(new ArrayList<>(sources));
    }

    /**
     * @return index of the frame these sources were detected in.
     */
    public int getFrameIndex() {
        return frameIndex;
    }

    public List<Source> getSources() {
        return sources;
    }

    public Source get(final int index) {
        return sources.get(index);
    }

    public int size() {
        return sources.size();
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    @Override
    public Iterator<Source> iterator() {
        return sources.iterator();
    }

    @Override
    public String toString() {
        return "{\"frameIndex\": " + frameIndex + ", \"size\": " + sources.size() + "}";
    }

}
