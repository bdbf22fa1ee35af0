package com.kolaps.cfgpetri.cfg;

import com.google.common.collect.ImmutableList;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Терминатор базового блока. Номера целевых блоков относятся к тому же графу.
 */
public abstract class Terminator {

    private static final int NONE = -1;

    private Terminator() {
    }

    public static Goto gotoBlock(int target) {
        return new Goto(target);
    }

    public static SwitchInt switchInt(int... targets) {
        checkArgument(targets.length > 0, "SwitchInt без целевых блоков");
        Set<Integer> distinct = new LinkedHashSet<>();
        for (int target : targets) {
            distinct.add(target);
        }
        return new SwitchInt(ImmutableList.copyOf(distinct));
    }

    public static Call call(FunctionId callee, List<Operand> args, Location destination, int target) {
        return new Call(callee, args, destination, target, NONE);
    }

    public static Call call(FunctionId callee, List<Operand> args, Location destination, int target, int cleanup) {
        return new Call(callee, args, destination, target, cleanup);
    }

    /** Вызов без возврата управления ({@code -> !}): {@code process::exit}, {@code panic}. */
    public static Call divergingCall(FunctionId callee, List<Operand> args, Location destination) {
        return new Call(callee, args, destination, NONE, NONE);
    }

    public static Return returnTerminator() {
        return Return.INSTANCE;
    }

    public static Unreachable unreachable() {
        return Unreachable.INSTANCE;
    }

    public static Resume resume() {
        return Resume.INSTANCE;
    }

    public static Drop drop(Location location, int target) {
        return new Drop(location, target, NONE);
    }

    public static Drop drop(Location location, int target, int cleanup) {
        return new Drop(location, target, cleanup);
    }

    public static Assert assertTerminator(int target) {
        return new Assert(target, NONE);
    }

    public static Assert assertTerminator(int target, int cleanup) {
        return new Assert(target, cleanup);
    }

    private static OptionalInt optional(int block) {
        return block == NONE ? OptionalInt.empty() : OptionalInt.of(block);
    }

    public static final class Goto extends Terminator {
        private final int target;

        private Goto(int target) {
            this.target = target;
        }

        public int getTarget() {
            return target;
        }

        @Override
        public String toString() {
            return "goto -> bb" + target;
        }
    }

    public static final class SwitchInt extends Terminator {
        private final ImmutableList<Integer> targets;

        private SwitchInt(ImmutableList<Integer> targets) {
            this.targets = targets;
        }

        /** Различные целевые блоки в порядке первого появления. */
        public List<Integer> getTargets() {
            return targets;
        }

        @Override
        public String toString() {
            return "switchInt -> " + targets;
        }
    }

    public static final class Call extends Terminator {
        private final FunctionId callee;
        private final ImmutableList<Operand> args;
        private final Location destination;
        private final int target;
        private final int cleanup;

        private Call(FunctionId callee, List<Operand> args, Location destination, int target, int cleanup) {
            this.callee = checkNotNull(callee);
            this.args = ImmutableList.copyOf(args);
            this.destination = checkNotNull(destination);
            this.target = target;
            this.cleanup = cleanup;
        }

        public FunctionId getCallee() {
            return callee;
        }

        public List<Operand> getArgs() {
            return args;
        }

        public Location getDestination() {
            return destination;
        }

        /** Блок возврата; пустое значение для функций, которые не возвращают управление. */
        public OptionalInt getTarget() {
            return optional(target);
        }

        public OptionalInt getCleanup() {
            return optional(cleanup);
        }

        @Override
        public String toString() {
            return destination + " = " + callee + args;
        }
    }

    public static final class Return extends Terminator {
        private static final Return INSTANCE = new Return();

        @Override
        public String toString() {
            return "return";
        }
    }

    public static final class Unreachable extends Terminator {
        private static final Unreachable INSTANCE = new Unreachable();

        @Override
        public String toString() {
            return "unreachable";
        }
    }

    /** Продолжение раскрутки стека после cleanup-блока. */
    public static final class Resume extends Terminator {
        private static final Resume INSTANCE = new Resume();

        @Override
        public String toString() {
            return "resume";
        }
    }

    public static final class Drop extends Terminator {
        private final Location location;
        private final int target;
        private final int cleanup;

        private Drop(Location location, int target, int cleanup) {
            this.location = checkNotNull(location);
            this.target = target;
            this.cleanup = cleanup;
        }

        public Location getLocation() {
            return location;
        }

        public int getTarget() {
            return target;
        }

        public OptionalInt getCleanup() {
            return optional(cleanup);
        }

        @Override
        public String toString() {
            return "drop(" + location + ") -> bb" + target;
        }
    }

    public static final class Assert extends Terminator {
        private final int target;
        private final int cleanup;

        private Assert(int target, int cleanup) {
            this.target = target;
            this.cleanup = cleanup;
        }

        public int getTarget() {
            return target;
        }

        public OptionalInt getCleanup() {
            return optional(cleanup);
        }

        @Override
        public String toString() {
            return "assert -> bb" + target;
        }
    }
}
