package com.kolaps.cfgpetri.cfg;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Правая часть присваивания. Транслятору важны только формы, которые переносят
 * дескрипторы примитивов: использование операнда, взятие ссылки и агрегат.
 */
public abstract class Rvalue {

    private Rvalue() {
    }

    public static Use use(Operand operand) {
        return new Use(operand);
    }

    public static Ref ref(Location location) {
        return new Ref(location);
    }

    public static Aggregate aggregate(Operand... fields) {
        return new Aggregate(ImmutableList.copyOf(fields));
    }

    public static Opaque opaque(String description) {
        return new Opaque(description);
    }

    /** {@code copy _1}, {@code move _2}, {@code const 5}. */
    public static final class Use extends Rvalue {
        private final Operand operand;

        private Use(Operand operand) {
            this.operand = checkNotNull(operand);
        }

        public Operand getOperand() {
            return operand;
        }

        @Override
        public String toString() {
            return operand.toString();
        }
    }

    /** {@code &_1}, {@code &(*_2)}. */
    public static final class Ref extends Rvalue {
        private final Location location;

        private Ref(Location location) {
            this.location = checkNotNull(location);
        }

        public Location getLocation() {
            return location;
        }

        @Override
        public String toString() {
            return "&" + location;
        }
    }

    /** Кортеж, структура или замыкание: операнд {@code j} попадает в поле {@code j}. */
    public static final class Aggregate extends Rvalue {
        private final ImmutableList<Operand> fields;

        private Aggregate(ImmutableList<Operand> fields) {
            this.fields = fields;
        }

        public List<Operand> getFields() {
            return fields;
        }

        @Override
        public String toString() {
            return "aggregate" + fields;
        }
    }

    /** Все остальное (арифметика, приведения типов): на дескрипторы не влияет. */
    public static final class Opaque extends Rvalue {
        private final String description;

        private Opaque(String description) {
            this.description = description;
        }

        @Override
        public String toString() {
            return description;
        }
    }
}
