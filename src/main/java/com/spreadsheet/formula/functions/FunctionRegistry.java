package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.evaluator.Values;
import com.spreadsheet.formula.exceptions.InvalidFunctionException;
import com.spreadsheet.formula.models.FunctionInfo;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog of built-in functions, looked up case-insensitively by name or alias.
 * Immutable once built, so one instance can be shared by every sheet.
 */
public class FunctionRegistry {

    private final Map<String, FunctionDefinition> byName;
    private final List<FunctionDefinition> definitions;

    public FunctionRegistry(Clock clock) {
        List<FunctionDefinition> list = new ArrayList<>();
        DateFunctions dates = new DateFunctions(clock);

        // Math
        list.add(define("SUM", "Add all arguments", Arity.atLeastOne(), MathFunctions::sum));
        list.add(define("AVERAGE", List.of("AVG"), "Average of all arguments",
                Arity.atLeastOne(), MathFunctions::average));
        list.add(define("MIN", "Smallest of all arguments", Arity.atLeastOne(), MathFunctions::min));
        list.add(define("MAX", "Largest of all arguments", Arity.atLeastOne(), MathFunctions::max));
        list.add(define("COUNT", "Count numeric values", Arity.atLeastOne(), MathFunctions::count));
        list.add(define("ADD", "ADD(a, b) adds two numbers", Arity.exactly(2), MathFunctions::add));
        list.add(define("SUB", "SUB(a, b) subtracts b from a", Arity.exactly(2), MathFunctions::sub));
        list.add(define("MUL", List.of("MULTIPLY"), "MUL(a, b) multiplies two numbers",
                Arity.exactly(2), MathFunctions::mul));
        list.add(define("DIV", List.of("DIVIDE"), "DIV(a, b) divides a by b",
                Arity.exactly(2), MathFunctions::div));

        // Logic
        list.add(define("IF", "IF(condition, value_if_true, value_if_false)",
                Arity.exactly(3), LogicFunctions::ifFunction));

        // Text
        list.add(define("CONCATENATE", List.of("CONCAT"), "Join all arguments as text",
                Arity.atLeastOne(), TextFunctions::concatenate));
        list.add(define("LEFT", "LEFT(text, num_chars) first characters of text",
                Arity.exactly(2), TextFunctions::left));
        list.add(define("RIGHT", "RIGHT(text, num_chars) last characters of text",
                Arity.exactly(2), TextFunctions::right));
        list.add(define("TRIM", "Remove leading and trailing whitespace", Arity.exactly(1), TextFunctions::trim));
        list.add(define("UPPER", "Convert text to upper case", Arity.exactly(1), TextFunctions::upper));
        list.add(define("LOWER", "Convert text to lower case", Arity.exactly(1), TextFunctions::lower));

        // Date
        list.add(define("NOW", "Current date and time as a timestamp", Arity.none(), dates::now));
        list.add(define("TODAY", "Start of the current day as a timestamp", Arity.none(), dates::today));
        list.add(define("DATE", "DATE(year, month, day) as a timestamp", Arity.exactly(3), dates::date));
        list.add(define("DATEDIF", "DATEDIF(start_date, end_date, unit) with unit D, M or Y",
                Arity.exactly(3), dates::datedif));

        // Conditional aggregates
        list.add(define("COUNTIF", "COUNTIF(range, criteria)", Arity.exactly(2), ConditionalFunctions::countIf));
        list.add(define("SUMIF", "SUMIF(range, criteria, [sum_range])",
                Arity.between(2, 3), ConditionalFunctions::sumIf));
        list.add(define("SUMIFS", "SUMIFS(sum_range, criteria_range1, criteria1, ...)",
                Arity.atLeast(3), ConditionalFunctions::sumIfs));

        // Lookup
        list.add(define("VLOOKUP", "VLOOKUP(lookup_value, table_range, col_index_num, [range_lookup])",
                Arity.between(3, 4), LookupFunctions::vlookup));
        list.add(define("HLOOKUP", "HLOOKUP(lookup_value, table_range, row_index_num, [range_lookup])",
                Arity.between(3, 4), LookupFunctions::hlookup));
        list.add(define("INDEX", "INDEX(array, row_num, [column_num])",
                Arity.between(2, 3), LookupFunctions::index));
        list.add(define("MATCH", "MATCH(lookup_value, lookup_array, [match_type])",
                Arity.between(2, 3), LookupFunctions::match));

        Map<String, FunctionDefinition> map = new LinkedHashMap<>();
        for (FunctionDefinition definition : list) {
            register(map, definition.getName(), definition);
            for (String alias : definition.getAliases()) {
                register(map, alias, definition);
            }
        }
        this.byName = Collections.unmodifiableMap(map);
        this.definitions = Collections.unmodifiableList(list);
    }

    public static FunctionRegistry createDefault() {
        return new FunctionRegistry(Clock.systemDefaultZone());
    }

    /**
     * @throws InvalidFunctionException if no function has this name or alias
     */
    public FunctionDefinition lookup(String name) {
        FunctionDefinition definition = byName.get(Values.upper(name));
        if (definition == null) {
            throw new InvalidFunctionException(name);
        }
        return definition;
    }

    public Object execute(String name, List<Object> args) {
        return lookup(name).invoke(Values.upper(name), args);
    }

    public boolean isSupported(String name) {
        return name != null && byName.containsKey(Values.upper(name));
    }

    public List<FunctionInfo> listFunctions() {
        List<FunctionInfo> infos = new ArrayList<>(definitions.size());
        for (FunctionDefinition definition : definitions) {
            infos.add(definition.toInfo());
        }
        return infos;
    }

    private static FunctionDefinition define(String name, String description, Arity arity,
                                             SpreadsheetFunction implementation) {
        return define(name, List.of(), description, arity, implementation);
    }

    private static FunctionDefinition define(String name, List<String> aliases, String description,
                                             Arity arity, SpreadsheetFunction implementation) {
        return new FunctionDefinition(name, aliases, description, arity, implementation);
    }

    private static void register(Map<String, FunctionDefinition> map, String key, FunctionDefinition definition) {
        if (map.putIfAbsent(key, definition) != null) {
            throw new IllegalStateException("Duplicate function name: " + key);
        }
    }
}
