package io.github.reugn.enumext4j.annotation;

/**
 * Primitive types usable as enum storage.
 *
 * @see EnumStorage
 */
public enum StorageType {
    BYTE("byte", Byte.MIN_VALUE, Byte.MAX_VALUE),
    SHORT("short", Short.MIN_VALUE, Short.MAX_VALUE),
    INT("int", Integer.MIN_VALUE, Integer.MAX_VALUE),
    LONG("long", Long.MIN_VALUE, Long.MAX_VALUE);

    private final String keyword;
    private final long min;
    private final long max;

    StorageType(String keyword, long min, long max) {
        this.keyword = keyword;
        this.min = min;
        this.max = max;
    }

    /**
     * Returns the Java keyword of this type, e.g. {@code "int"}.
     *
     * @return the primitive type keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Checks whether a value is representable in this type.
     *
     * @param value the value to check
     * @return {@code true} if {@code value} is within range
     */
    public boolean fits(long value) {
        return value >= min && value <= max;
    }

    /**
     * Looks up a storage type by its Java keyword.
     *
     * @param keyword a primitive type keyword
     * @return the matching type, or {@code null} if none matches
     */
    public static StorageType fromKeyword(String keyword) {
        for (StorageType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        return null;
    }
}
