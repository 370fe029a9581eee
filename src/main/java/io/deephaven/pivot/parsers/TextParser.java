package io.deephaven.pivot.parsers;

import org.jetbrains.annotations.NotNull;

/**
 * The parser for the text domain. Every cell is a valid text value. Not actually an 'enum'. We use this as a Java trick
 * to get singletons.
 */
public enum TextParser implements DomainParser<String> {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public ValueType valueType() {
        return ValueType.TEXT;
    }

    @NotNull
    @Override
    public String tryParse(@NotNull String text) {
        return text;
    }

    @Override
    public String describeFailure(String text) {
        return String.format("`%s` is not valid text", text);
    }

    @Override
    public String format(@NotNull String value) {
        return value;
    }
}
