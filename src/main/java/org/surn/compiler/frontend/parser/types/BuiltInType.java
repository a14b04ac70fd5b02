package org.surn.compiler.frontend.parser.types;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The types defined by the language itself.
 * <p>
 * The sized integer and float types ({@code u8} .. {@code f64}) are the strict variants used when
 * strict typing is enabled.
 */
public enum BuiltInType {
    /** A single byte. */
    BYTE("byte"),
    /** A 16 bit integer. */
    SHORT("short"),
    /** An integer up to 64 bits. */
    INT("int"),
    /** A 128 bit integer. */
    LONG("long"),
    FLOAT("float"),
    DOUBLE("double"),
    BOOL("bool"),
    STRING("string"),
    /** An array of {@code any}. */
    ARRAY("array"),
    /** Any value; rejected in strict mode. */
    ANY("any"),
    U8("u8", true),
    U16("u16", true),
    U32("u32", true),
    U64("u64", true),
    U128("u128", true),
    I8("i8", true),
    I16("i16", true),
    I32("i32", true),
    I64("i64", true),
    I128("i128", true),
    F32("f32", true),
    F64("f64", true);

    private static final Map<String, BuiltInType> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(BuiltInType::typeName, Function.identity()));

    private final String typeName;
    private final boolean strict;

    BuiltInType(String typeName) {
        this(typeName, false);
    }

    BuiltInType(String typeName, boolean strict) {
        this.typeName = typeName;
        this.strict = strict;
    }

    /**
     * @return The name used in source code.
     */
    public String typeName() {
        return typeName;
    }

    /**
     * @return {@code true} for the sized strict types.
     */
    public boolean isStrict() {
        return strict;
    }

    /**
     * @param name A type name as written in source code.
     * @return The built-in type with that name, or empty.
     */
    public static Optional<BuiltInType> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
