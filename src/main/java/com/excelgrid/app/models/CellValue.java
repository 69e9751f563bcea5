package com.excelgrid.app.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Evaluated content of a cell: a number, a piece of text, nothing,
 * or an error sentinel.
 * Serialized to JSON as a number, the text, "" or the error code.
 */
public final class CellValue {

    public enum Kind {
        NUMBER,
        TEXT,
        BLANK,
        ERROR
    }

    // Plain decimal literal, optionally signed, optionally with an exponent
    private static final Pattern NUMERIC_LITERAL =
            Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");

    public static final CellValue BLANK = new CellValue(Kind.BLANK, 0d, null, null);
    public static final CellValue GENERIC_ERROR = new CellValue(Kind.ERROR, 0d, null, ErrorKind.GENERIC_ERROR);
    public static final CellValue CIRCULAR_REFERENCE = new CellValue(Kind.ERROR, 0d, null, ErrorKind.CIRCULAR_REFERENCE);

    private final Kind kind;
    private final double number;
    private final String text;
    private final ErrorKind error;

    private CellValue(Kind kind, double number, String text, ErrorKind error) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.error = error;
    }

    public static CellValue number(double value) {
        return new CellValue(Kind.NUMBER, value, null, null);
    }

    public static CellValue text(String value) {
        return new CellValue(Kind.TEXT, 0d, Objects.requireNonNull(value), null);
    }

    public static CellValue error(ErrorKind kind) {
        return kind == ErrorKind.CIRCULAR_REFERENCE ? CIRCULAR_REFERENCE : GENERIC_ERROR;
    }

    /**
     * Interprets non-formula raw cell text: blank stays blank,
     * numeric literals become numbers, anything else is text.
     */
    public static CellValue fromLiteral(String raw) {
        if (raw == null || raw.isBlank()) {
            return BLANK;
        }
        String trimmed = raw.trim();
        if (NUMERIC_LITERAL.matcher(trimmed).matches()) {
            return number(Double.parseDouble(trimmed));
        }
        return text(raw);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    public boolean isBlank() {
        return kind == Kind.BLANK;
    }

    public double getNumber() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("Not a number: " + this);
        }
        return number;
    }

    public String getText() {
        return text;
    }

    public ErrorKind getError() {
        return error;
    }

    /**
     * Host-facing encoding used by JSON responses.
     */
    @JsonValue
    public Object toDisplayValue() {
        switch (kind) {
            case NUMBER:
                return number;
            case TEXT:
                return text;
            case ERROR:
                return error.getCode();
            default:
                return "";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        return kind == other.kind
                && Double.compare(number, other.number) == 0
                && Objects.equals(text, other.text)
                && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, text, error);
    }

    @Override
    public String toString() {
        return String.valueOf(toDisplayValue());
    }
}
