package org.gritvm.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The resizable, 0-indexed data memory of the machine.
 * <p>
 * A location is valid iff {@code 0 <= location < size}. Insertion additionally accepts
 * {@code location == size}, which appends. Callers are expected to check validity before
 * mutating; the mutators throw {@link IndexOutOfBoundsException} on invalid locations so that a
 * missed check cannot silently corrupt memory.
 */
public class DataMemory {

    private final List<Long> cells = new ArrayList<>();

    /**
     * @return the number of cells.
     */
    public int size() {
        return cells.size();
    }

    /**
     * @return true if there are no cells.
     */
    public boolean isEmpty() {
        return cells.isEmpty();
    }

    /**
     * Checks strict validity for reads, writes and erasure.
     *
     * @param location The location to check.
     * @return true if {@code 0 <= location < size}.
     */
    public boolean isValid(long location) {
        return location >= 0 && location < cells.size();
    }

    /**
     * Checks validity for insertion, which also accepts the end of memory.
     *
     * @param location The location to check.
     * @return true if {@code 0 <= location <= size}.
     */
    public boolean isInsertable(long location) {
        return location >= 0 && location <= cells.size();
    }

    public long get(long location) {
        requireValid(location);
        return cells.get((int) location);
    }

    public void set(long location, long value) {
        requireValid(location);
        cells.set((int) location, value);
    }

    /**
     * Inserts a value, shifting later cells one position to the right.
     *
     * @param location The target location, {@code 0 <= location <= size}.
     * @param value The value to insert.
     */
    public void insert(long location, long value) {
        if (!isInsertable(location)) {
            throw new IndexOutOfBoundsException("Insert location " + location + " out of range for size " + cells.size());
        }
        cells.add((int) location, value);
    }

    /**
     * Removes a value, shifting later cells one position to the left.
     *
     * @param location The location to remove.
     * @return The removed value.
     */
    public long erase(long location) {
        requireValid(location);
        return cells.remove((int) location);
    }

    /**
     * Replaces the whole content with a copy of the given values.
     *
     * @param values The new content. Must not contain null.
     */
    public void replaceWith(List<Long> values) {
        Objects.requireNonNull(values, "values");
        List<Long> copy = new ArrayList<>(values.size());
        for (Long value : values) {
            copy.add(Objects.requireNonNull(value, "memory cell"));
        }
        cells.clear();
        cells.addAll(copy);
    }

    public void clear() {
        cells.clear();
    }

    /**
     * Returns a copy of the current content. Later changes to the memory are not visible in it.
     *
     * @return an unmodifiable snapshot.
     */
    public List<Long> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(cells));
    }

    private void requireValid(long location) {
        if (!isValid(location)) {
            throw new IndexOutOfBoundsException("Location " + location + " out of range for size " + cells.size());
        }
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
