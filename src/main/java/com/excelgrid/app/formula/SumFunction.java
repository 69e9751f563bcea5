package com.excelgrid.app.formula;

import com.excelgrid.app.exceptions.InvalidRangeException;
import com.excelgrid.app.exceptions.InvalidReferenceException;
import com.excelgrid.app.models.CellAddress;
import com.excelgrid.app.models.CellRange;
import com.excelgrid.app.models.CellValue;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SUM over a rectangular range. Only recognized when it is the entire
 * formula body, e.g. "SUM(D2:D4)"; it does not nest inside expressions.
 */
public class SumFunction {

    private static final Pattern SUM_PATTERN = Pattern.compile("^SUM\\(([A-Z]+\\d+):([A-Z]+\\d+)\\)$");

    /**
     * @return the range if 'body' is a whole-formula SUM call, empty otherwise
     * @throws InvalidRangeException if it is a SUM call with an unparsable bound
     */
    public Optional<CellRange> matchRange(String body) {
        Matcher matcher = SUM_PATTERN.matcher(body);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new CellRange(
                    CellAddressCodec.parse(matcher.group(1)),
                    CellAddressCodec.parse(matcher.group(2))));
        } catch (InvalidReferenceException e) {
            throw new InvalidRangeException("Invalid range in SUM function: " + body, e);
        }
    }

    /**
     * Adds every numeric cell of the range that lies inside a rows x cols grid.
     * Text, blank and errored cells contribute 0; the part of the range past
     * the grid edge is never visited.
     */
    public double sum(CellRange range, CellResolver resolver, int rows, int cols) {
        double total = 0d;
        for (CellAddress address : range.addressesWithin(rows, cols)) {
            CellValue value = resolver.resolve(address.toLabel());
            if (value != null && value.isNumber() && !Double.isNaN(value.getNumber())) {
                total += value.getNumber();
            }
        }
        return total;
    }
}
