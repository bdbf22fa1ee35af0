package com.kolaps.cfgpetri.cfg;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Место хранения в кадре функции: локальная переменная (корень) и путь уточнений.
 * Локальная {@code _0} это возвращаемое значение, {@code _1.._n} аргументы функции.
 */
public final class Location {

    public static final Location RETURN_VALUE = local(0);

    private final int root;
    private final ImmutableList<Projection> projections;

    private Location(int root, ImmutableList<Projection> projections) {
        this.root = root;
        this.projections = projections;
    }

    public static Location local(int root) {
        checkArgument(root >= 0, "Номер локальной переменной не может быть отрицательным: %s", root);
        return new Location(root, ImmutableList.of());
    }

    /** Параметр функции с номером {@code position} (считая с нуля), т.е. локальная {@code _(position+1)}. */
    public static Location argument(int position) {
        return local(position + 1);
    }

    public Location field(int index) {
        return project(Projection.field(index));
    }

    public Location deref() {
        return project(Projection.deref());
    }

    public Location project(Projection projection) {
        return new Location(root, ImmutableList.<Projection>builder().addAll(projections).add(projection).build());
    }

    public int getRoot() {
        return root;
    }

    public List<Projection> getProjections() {
        return projections;
    }

    public boolean hasSameRoot(Location other) {
        return root == other.root;
    }

    public boolean endsWithDeref() {
        return !projections.isEmpty() && projections.get(projections.size() - 1).getKind() == Projection.Kind.DEREF;
    }

    /**
     * @return место без последнего уточнения ({@code (*_2)} превращается в {@code _2})
     */
    public Location parent() {
        checkState(!projections.isEmpty(), "У места %s нет уточнений", this);
        return new Location(root, projections.subList(0, projections.size() - 1));
    }

    /**
     * Переносит место с префикса {@code from} на префикс {@code to}:
     * {@code _3.1} относительно {@code _3} и {@code _1} дает {@code _1.1}.
     *
     * @return пустое значение, если место не начинается с {@code from}
     */
    public Optional<Location> rebase(Location from, Location to) {
        if (root != from.root || projections.size() < from.projections.size()
                || !projections.subList(0, from.projections.size()).equals(from.projections)) {
            return Optional.empty();
        }
        ImmutableList<Projection> rebased = ImmutableList.<Projection>builder()
                .addAll(to.projections)
                .addAll(projections.subList(from.projections.size(), projections.size()))
                .build();
        return Optional.of(new Location(to.root, rebased));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Location that = (Location) o;
        return root == that.root && projections.equals(that.projections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, projections);
    }

    @Override
    public String toString() {
        String result = "_" + root;
        for (Projection projection : projections) {
            result = projection.getKind() == Projection.Kind.DEREF ? "(*" + result + ")" : result + projection;
        }
        return result;
    }
}
