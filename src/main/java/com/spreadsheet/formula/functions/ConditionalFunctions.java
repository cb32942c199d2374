package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluator.Grid;
import com.spreadsheet.formula.evaluator.Values;
import com.spreadsheet.formula.exceptions.FunctionArgumentException;

import java.util.ArrayList;
import java.util.List;

/**
 * COUNTIF, SUMIF and SUMIFS.
 */
final class ConditionalFunctions {

    private ConditionalFunctions() {
    }

    // COUNTIF(range, criteria)
    static Object countIf(List<Object> args) {
        Grid range = Arguments.grid("COUNTIF", args.get(0), "first argument");
        Criteria criteria = Criteria.parse("COUNTIF", Arguments.scalar("COUNTIF", args.get(1), "criteria"));
        int count = 0;
        for (Object value : range.values()) {
            if (criteria.matches(value)) {
                count++;
            }
        }
        return (double) count;
    }

    // SUMIF(range, criteria, [sum_range])
    static Object sumIf(List<Object> args) {
        Grid range = Arguments.grid("SUMIF", args.get(0), "first argument");
        Criteria criteria = Criteria.parse("SUMIF", Arguments.scalar("SUMIF", args.get(1), "criteria"));
        Grid sumRange = range;
        if (args.size() == 3) {
            sumRange = Arguments.grid("SUMIF", args.get(2), "sum_range");
            if (!sumRange.sameShapeAs(range)) {
                throw new FunctionArgumentException("SUMIF", "range and sum_range must be the same size");
            }
        }

        List<Object> tested = range.values();
        List<Object> summed = sumRange.values();
        double sum = 0;
        for (int i = 0; i < tested.size(); i++) {
            if (criteria.matches(tested.get(i))) {
                sum += numberOrZero(summed.get(i));
            }
        }
        return sum;
    }

    // SUMIFS(sum_range, criteria_range1, criteria1, [criteria_range2, criteria2], ...)
    static Object sumIfs(List<Object> args) {
        if (args.size() % 2 == 0) {
            throw new FunctionArgumentException("SUMIFS",
                    "requires sum_range and at least one criteria_range/criteria pair (odd number of arguments)");
        }
        Grid sumRange = Arguments.grid("SUMIFS", args.get(0), "sum_range");

        List<List<Object>> criteriaValues = new ArrayList<>();
        List<Criteria> criteria = new ArrayList<>();
        for (int i = 1; i < args.size(); i += 2) {
            int pair = (i + 1) / 2;
            Grid criteriaRange = Arguments.grid("SUMIFS", args.get(i), "criteria_range" + pair);
            if (!criteriaRange.sameShapeAs(sumRange)) {
                throw new FunctionArgumentException("SUMIFS", "all ranges must be the same size");
            }
            criteriaValues.add(criteriaRange.values());
            criteria.add(Criteria.parse("SUMIFS", Arguments.scalar("SUMIFS", args.get(i + 1), "criteria" + pair)));
        }

        List<Object> summed = sumRange.values();
        double sum = 0;
        for (int i = 0; i < summed.size(); i++) {
            boolean all = true;
            for (int c = 0; c < criteria.size() && all; c++) {
                all = criteria.get(c).matches(criteriaValues.get(c).get(i));
            }
            if (all) {
                sum += numberOrZero(summed.get(i));
            }
        }
        return sum;
    }

    private static double numberOrZero(Object value) {
        Double number = Values.tryToNumber(value);
        return number == null ? 0 : number;
    }
}
