package com.excelgrid.app.formula;

import com.excelgrid.app.exceptions.InvalidReferenceException;
import com.excelgrid.app.models.CellAddress;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between zero-based cell coordinates and spreadsheet labels.
 * Rows are 1-based in labels; columns use bijective base-26
 * (A=1 .. Z=26, no zero digit), so 0 -> "A", 25 -> "Z", 26 -> "AA".
 */
public final class CellAddressCodec {

    private static final Pattern LABEL_PATTERN = Pattern.compile("^([A-Z]+)([1-9][0-9]*)$");

    private CellAddressCodec() {
    }

    /**
     * Parses a label like "AB12" into (row 11, col 27).
     * Throws InvalidReferenceException if the label is malformed
     * or does not fit in int coordinates.
     */
    public static CellAddress parse(String label) {
        if (label == null) {
            throw new InvalidReferenceException("Missing cell reference");
        }
        Matcher matcher = LABEL_PATTERN.matcher(label);
        if (!matcher.matches()) {
            throw new InvalidReferenceException("Invalid cell reference: " + label);
        }

        String letters = matcher.group(1);
        long col = 0;
        for (int i = 0; i < letters.length(); i++) {
            col = col * 26 + (letters.charAt(i) - 'A' + 1);
            if (col > Integer.MAX_VALUE) {
                throw new InvalidReferenceException("Column out of range in " + label);
            }
        }

        int row;
        try {
            row = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new InvalidReferenceException("Row out of range in " + label);
        }
        return CellAddress.of(row - 1, (int) (col - 1));
    }

    public static String format(CellAddress address) {
        return format(address.getRow(), address.getCol());
    }

    public static String format(int row, int col) {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Negative cell coordinate: (" + row + ", " + col + ")");
        }
        return columnName(col) + ((long) row + 1);
    }

    /**
     * Column letters only, e.g. 27 -> "AB".
     */
    public static String columnName(int col) {
        StringBuilder letters = new StringBuilder();
        long remaining = (long) col + 1;
        while (remaining > 0) {
            remaining -= 1;
            letters.insert(0, (char) ('A' + remaining % 26));
            remaining /= 26;
        }
        return letters.toString();
    }
}
