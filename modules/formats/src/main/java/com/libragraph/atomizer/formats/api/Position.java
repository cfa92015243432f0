package com.libragraph.atomizer.formats.api;

import java.util.Comparator;

/**
 * Structural or spatial coordinate of a component within its parent.
 *
 * <p>Axis meaning is chosen by the atomizer: character offset, line/column, pixel
 * {@code (x, y, layer, frame)}, seconds, tensor element index. {@code path} names a
 * location in a tree (JSON pointer, archive entry, tensor name) and may be null.
 * Positions of one parent's children are comparable with {@link #compareTo}.
 */
public record Position(double x, double y, double z, double m, String path) implements Comparable<Position> {

    private static final Comparator<Position> ORDER = Comparator
            .comparingDouble(Position::m)
            .thenComparingDouble(Position::z)
            .thenComparingDouble(Position::y)
            .thenComparingDouble(Position::x)
            .thenComparing(Position::path, Comparator.nullsFirst(Comparator.naturalOrder()));

    public static Position offset(long offset) {
        return new Position(offset, 0, 0, 0, null);
    }

    public static Position lineColumn(int line, int column) {
        return new Position(column, line, 0, 0, null);
    }

    public static Position pixel(int x, int y, int layer, int frame) {
        return new Position(x, y, layer, frame, null);
    }

    public static Position time(double seconds) {
        return new Position(0, 0, 0, seconds, null);
    }

    public static Position tensor(String name, long elementIndex) {
        return new Position(elementIndex, 0, 0, 0, name);
    }

    public static Position path(String path) {
        return new Position(0, 0, 0, 0, path);
    }

    public Position withPath(String newPath) {
        return new Position(x, y, z, m, newPath);
    }

    public Position withTime(double seconds) {
        return new Position(x, y, z, seconds, path);
    }

    @Override
    public int compareTo(Position other) {
        return ORDER.compare(this, other);
    }
}
