package com.largomodo.folio.geom;

import java.util.Iterator;
import java.util.List;

/**
 * The frames produced by one layout call, one per consumed region.
 */
public final class Fragment implements Iterable<Frame> {

    private final List<Frame> frames;

    public Fragment(List<Frame> frames) {
        this.frames = List.copyOf(frames);
    }

    public static Fragment of(Frame frame) {
        return new Fragment(List.of(frame));
    }

    public List<Frame> frames() {
        return frames;
    }

    public int size() {
        return frames.size();
    }

    public Frame get(int index) {
        return frames.get(index);
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /**
     * Returns the only frame of a single-region fragment.
     *
     * @throws IllegalStateException if the fragment spans more or fewer than one region
     */
    public Frame intoFrame() {
        if (frames.size() != 1) {
            throw new IllegalStateException("Expected exactly one frame, found " + frames.size());
        }
        return frames.get(0);
    }

    @Override
    public Iterator<Frame> iterator() {
        return frames.iterator();
    }

    @Override
    public String toString() {
        return "Fragment" + frames;
    }
}
