package com.kolaps.cfgpetri.cfg;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Операнд вызова или присваивания.
 * <p>
 * Константы не несут места хранения, но могут ссылаться на функцию
 * (указатель на функцию, который передается в {@code std::thread::spawn}).
 * Замыкание передается перемещением своего места с указанием функции тела.
 */
public final class Operand {

    public enum Kind {
        COPY,
        MOVE,
        CONSTANT
    }

    private final Kind kind;
    private final Location location;
    private final FunctionId function;

    private Operand(Kind kind, Location location, FunctionId function) {
        this.kind = kind;
        this.location = location;
        this.function = function;
    }

    public static Operand copy(Location location) {
        return new Operand(Kind.COPY, checkNotNull(location), null);
    }

    public static Operand move(Location location) {
        return new Operand(Kind.MOVE, checkNotNull(location), null);
    }

    public static Operand constant() {
        return new Operand(Kind.CONSTANT, null, null);
    }

    public static Operand function(FunctionId function) {
        return new Operand(Kind.CONSTANT, null, checkNotNull(function));
    }

    /** Замыкание в локальной {@code location}, тело которого {@code body}. */
    public static Operand closure(Location location, FunctionId body) {
        return new Operand(Kind.MOVE, checkNotNull(location), checkNotNull(body));
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<Location> getLocation() {
        return Optional.ofNullable(location);
    }

    public Optional<FunctionId> getFunction() {
        return Optional.ofNullable(function);
    }

    @Override
    public String toString() {
        switch (kind) {
            case COPY:
                return "copy " + location;
            case MOVE:
                return function == null ? "move " + location : "move " + location + " {" + function + "}";
            default:
                return function == null ? "const" : "const " + function;
        }
    }
}
