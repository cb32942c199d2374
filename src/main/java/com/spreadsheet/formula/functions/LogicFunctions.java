package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluator.Values;

import java.util.List;

final class LogicFunctions {

    private LogicFunctions() {
    }

    // IF(condition, value_if_true, value_if_false); only the chosen branch must be a single value
    static Object ifFunction(List<Object> args) {
        boolean condition = Values.toBoolean(Arguments.scalar("IF", args.get(0), "condition"));
        return condition
                ? Arguments.scalar("IF", args.get(1), "value_if_true")
                : Arguments.scalar("IF", args.get(2), "value_if_false");
    }
}
