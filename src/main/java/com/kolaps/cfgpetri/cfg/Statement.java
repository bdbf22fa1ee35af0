package com.kolaps.cfgpetri.cfg;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Оператор базового блока. Каждый оператор становится одним переходом сети,
 * присваивание дополнительно обновляет память дескрипторов.
 */
public abstract class Statement {

    private Statement() {
    }

    public static Assign assign(Location target, Rvalue value) {
        return new Assign(target, value);
    }

    public static Nop nop(String description) {
        return new Nop(description);
    }

    public static final class Assign extends Statement {
        private final Location target;
        private final Rvalue value;

        private Assign(Location target, Rvalue value) {
            this.target = checkNotNull(target);
            this.value = checkNotNull(value);
        }

        public Location getTarget() {
            return target;
        }

        public Rvalue getValue() {
            return value;
        }

        @Override
        public String toString() {
            return target + " = " + value;
        }
    }

    /** StorageLive, StorageDead, FakeRead и прочее без влияния на дескрипторы. */
    public static final class Nop extends Statement {
        private final String description;

        private Nop(String description) {
            this.description = description;
        }

        @Override
        public String toString() {
            return description;
        }
    }
}
