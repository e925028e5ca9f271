package dev.mars.pgscope.test.memory;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.pgscope.api.query.QueryResult;
import dev.mars.pgscope.api.query.Row;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interpreter for the small SQL subset the in-memory driver understands.
 *
 * <ul>
 *   <li>{@code CREATE TABLE [IF NOT EXISTS] t (col type, ...)} and {@code DROP TABLE [IF EXISTS] t}</li>
 *   <li>{@code INSERT INTO t (cols) VALUES (...), (...) [RETURNING cols|*]}</li>
 *   <li>{@code SELECT cols|*|COUNT(*) [FROM t [WHERE ...] [ORDER BY col [ASC|DESC]]]}</li>
 *   <li>{@code UPDATE t SET col = value | col = col +/- value, ... [WHERE ...]}</li>
 *   <li>{@code DELETE FROM t [WHERE ...]}</li>
 * </ul>
 *
 * <p>WHERE clauses are {@code AND}-joined comparisons {@code col op value} or {@code col IS [NOT] NULL}.
 * Values are {@code ?} parameters, numbers, quoted strings, {@code TRUE}, {@code FALSE} or {@code NULL}.</p>
 */
final class InMemorySql {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final Pattern CREATE = Pattern.compile(
        "^\\s*CREATE\\s+TABLE\\s+(IF\\s+NOT\\s+EXISTS\\s+)?(\\w+)\\s*\\((.*)\\)\\s*;?\\s*$", FLAGS);
    private static final Pattern DROP = Pattern.compile(
        "^\\s*DROP\\s+TABLE\\s+(IF\\s+EXISTS\\s+)?(\\w+)\\s*;?\\s*$", FLAGS);
    private static final Pattern INSERT = Pattern.compile(
        "^\\s*INSERT\\s+INTO\\s+(\\w+)\\s*\\(([^)]*)\\)\\s*VALUES\\s*(.*?)(\\s+RETURNING\\s+(.*?))?\\s*;?\\s*$", FLAGS);
    private static final Pattern SELECT = Pattern.compile(
        "^\\s*SELECT\\s+(.*?)(\\s+FROM\\s+(\\w+)(\\s+WHERE\\s+(.*?))?(\\s+ORDER\\s+BY\\s+(\\w+)(\\s+(ASC|DESC))?)?)?\\s*;?\\s*$", FLAGS);
    private static final Pattern UPDATE = Pattern.compile(
        "^\\s*UPDATE\\s+(\\w+)\\s+SET\\s+(.*?)(\\s+WHERE\\s+(.*?))?\\s*;?\\s*$", FLAGS);
    private static final Pattern DELETE = Pattern.compile(
        "^\\s*DELETE\\s+FROM\\s+(\\w+)(\\s+WHERE\\s+(.*?))?\\s*;?\\s*$", FLAGS);

    private static final Pattern CONDITION = Pattern.compile(
        "^\\s*(\\w+)\\s*(=|<>|!=|<=|>=|<|>)\\s*(.+?)\\s*$", FLAGS);
    private static final Pattern NULL_CHECK = Pattern.compile(
        "^\\s*(\\w+)\\s+IS\\s+(NOT\\s+)?NULL\\s*$", FLAGS);
    private static final Pattern ASSIGNMENT = Pattern.compile(
        "^\\s*(\\w+)\\s*=\\s*(.+?)\\s*$", FLAGS);
    private static final Pattern ARITHMETIC = Pattern.compile(
        "^(\\w+)\\s*([+-])\\s*(.+)$", FLAGS);
    private static final Pattern ALIAS = Pattern.compile(
        "^(.+?)\\s+AS\\s+(\\w+)$", FLAGS);
    private static final Pattern AND = Pattern.compile("\\s+AND\\s+", FLAGS);

    private InMemorySql() {
    }

    static QueryResult execute(Map<String, InMemoryTable> tables, String sql, List<Object> params) {
        Params cursor = new Params(params);
        Matcher m;
        if ((m = SELECT.matcher(sql)).matches()) {
            return select(tables, m, cursor);
        }
        if ((m = INSERT.matcher(sql)).matches()) {
            return insert(tables, m, cursor);
        }
        if ((m = UPDATE.matcher(sql)).matches()) {
            return update(tables, m, cursor);
        }
        if ((m = DELETE.matcher(sql)).matches()) {
            return delete(tables, m, cursor);
        }
        if ((m = CREATE.matcher(sql)).matches()) {
            return create(tables, m);
        }
        if ((m = DROP.matcher(sql)).matches()) {
            String name = key(m.group(2));
            if (tables.remove(name) == null && m.group(1) == null) {
                throw new InMemorySqlException("table \"" + name + "\" does not exist");
            }
            return QueryResult.command("DROP TABLE", 0);
        }
        throw new InMemorySqlException("unsupported statement: " + sql);
    }

    private static QueryResult create(Map<String, InMemoryTable> tables, Matcher m) {
        String name = key(m.group(2));
        if (tables.containsKey(name)) {
            if (m.group(1) != null) {
                return QueryResult.command("CREATE TABLE", 0);
            }
            throw new InMemorySqlException("relation \"" + name + "\" already exists");
        }
        List<String> columns = new ArrayList<>();
        for (String definition : splitTopLevel(m.group(3))) {
            String column = definition.trim().split("\\s+")[0];
            columns.add(key(column));
        }
        tables.put(name, new InMemoryTable(name, columns));
        return QueryResult.command("CREATE TABLE", 0);
    }

    private static QueryResult insert(Map<String, InMemoryTable> tables, Matcher m, Params params) {
        InMemoryTable table = table(tables, m.group(1));
        List<String> columns = new ArrayList<>();
        for (String column : splitTopLevel(m.group(2))) {
            String name = key(column.trim());
            table.checkColumn(name);
            columns.add(name);
        }
        List<Map<String, Object>> inserted = new ArrayList<>();
        for (String tuple : tuples(m.group(3))) {
            List<String> values = splitTopLevel(tuple);
            if (values.size() != columns.size()) {
                throw new InMemorySqlException("INSERT has " + values.size() + " values for " + columns.size() + " columns");
            }
            Map<String, Object> row = new LinkedHashMap<>();
            table.columns().forEach(column -> row.put(column, null));
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), value(values.get(i), params));
            }
            table.rows().add(row);
            inserted.add(row);
        }
        if (m.group(5) != null) {
            List<Row> rows = project(table, inserted, m.group(5), params);
            return new QueryResult(rows, inserted.size(), "INSERT 0 " + inserted.size());
        }
        return QueryResult.command("INSERT 0 " + inserted.size(), inserted.size());
    }

    private static QueryResult select(Map<String, InMemoryTable> tables, Matcher m, Params params) {
        String projection = m.group(1).trim();
        if (m.group(3) == null) {
            List<String> names = new ArrayList<>();
            List<Object> values = new ArrayList<>();
            for (String item : splitTopLevel(projection)) {
                String expression = item.trim();
                String name = "?column?";
                Matcher alias = ALIAS.matcher(expression);
                if (alias.matches()) {
                    expression = alias.group(1).trim();
                    name = key(alias.group(2));
                }
                names.add(name);
                values.add(value(expression, params));
            }
            return QueryResult.of(List.of(new Row(names, values)), "SELECT 1");
        }
        InMemoryTable table = table(tables, m.group(3));
        // projection parameters precede WHERE parameters in the text
        boolean count = projection.replaceAll("\\s+", "").equalsIgnoreCase("COUNT(*)");
        List<String> items = count ? List.of() : splitTopLevel(projection);
        List<Object> projectedLiterals = new ArrayList<>();
        for (String item : items) {
            String expression = stripAlias(item.trim());
            if (!expression.equals("*") && !isColumn(table, expression)) {
                projectedLiterals.add(value(expression, params));
            }
        }
        List<Map<String, Object>> matched = filter(table, m.group(5), params);
        if (m.group(7) != null) {
            String orderColumn = key(m.group(7));
            table.checkColumn(orderColumn);
            Comparator<Map<String, Object>> order = (a, b) -> compareNullsLast(a.get(orderColumn), b.get(orderColumn));
            if (m.group(9) != null && m.group(9).equalsIgnoreCase("DESC")) {
                order = order.reversed();
            }
            matched.sort(order);
        }
        if (count) {
            return QueryResult.of(List.of(new Row(List.of("count"), List.of((long) matched.size()))), "SELECT 1");
        }
        List<Row> rows = new ArrayList<>();
        for (Map<String, Object> source : matched) {
            List<String> names = new ArrayList<>();
            List<Object> values = new ArrayList<>();
            int literal = 0;
            for (String item : items) {
                String trimmed = item.trim();
                Matcher alias = ALIAS.matcher(trimmed);
                String expression = alias.matches() ? alias.group(1).trim() : trimmed;
                if (expression.equals("*")) {
                    names.addAll(table.columns());
                    table.columns().forEach(column -> values.add(source.get(column)));
                } else if (isColumn(table, expression)) {
                    names.add(alias.matches() ? key(alias.group(2)) : key(expression));
                    values.add(source.get(key(expression)));
                } else {
                    names.add(alias.matches() ? key(alias.group(2)) : "?column?");
                    values.add(projectedLiterals.get(literal++));
                }
            }
            rows.add(new Row(names, values));
        }
        return QueryResult.of(rows, "SELECT " + rows.size());
    }

    private static QueryResult update(Map<String, InMemoryTable> tables, Matcher m, Params params) {
        InMemoryTable table = table(tables, m.group(1));
        List<String[]> assignments = new ArrayList<>();
        List<Object> operands = new ArrayList<>();
        for (String part : splitTopLevel(m.group(2))) {
            Matcher assignment = ASSIGNMENT.matcher(part);
            if (!assignment.matches()) {
                throw new InMemorySqlException("unsupported assignment: " + part);
            }
            String column = key(assignment.group(1));
            table.checkColumn(column);
            String expression = assignment.group(2).trim();
            Matcher arithmetic = ARITHMETIC.matcher(expression);
            if (arithmetic.matches() && isColumn(table, arithmetic.group(1))) {
                assignments.add(new String[] {column, key(arithmetic.group(1)), arithmetic.group(2)});
                operands.add(value(arithmetic.group(3).trim(), params));
            } else {
                assignments.add(new String[] {column, null, null});
                operands.add(value(expression, params));
            }
        }
        List<Map<String, Object>> matched = filter(table, m.group(4), params);
        for (Map<String, Object> row : matched) {
            for (int i = 0; i < assignments.size(); i++) {
                String[] assignment = assignments.get(i);
                Object operand = operands.get(i);
                if (assignment[1] == null) {
                    row.put(assignment[0], operand);
                } else {
                    row.put(assignment[0], arithmetic(row.get(assignment[1]), assignment[2], operand));
                }
            }
        }
        return QueryResult.command("UPDATE " + matched.size(), matched.size());
    }

    private static QueryResult delete(Map<String, InMemoryTable> tables, Matcher m, Params params) {
        InMemoryTable table = table(tables, m.group(1));
        List<Map<String, Object>> matched = filter(table, m.group(3), params);
        table.rows().removeIf(row -> matched.stream().anyMatch(candidate -> candidate == row));
        return QueryResult.command("DELETE " + matched.size(), matched.size());
    }

    private static List<Map<String, Object>> filter(InMemoryTable table, String where, Params params) {
        List<Map<String, Object>> matched = new ArrayList<>(table.rows());
        if (where == null || where.isBlank()) {
            return matched;
        }
        for (String clause : AND.split(where.trim())) {
            Matcher nullCheck = NULL_CHECK.matcher(clause);
            if (nullCheck.matches()) {
                String column = key(nullCheck.group(1));
                table.checkColumn(column);
                boolean negate = nullCheck.group(2) != null;
                matched.removeIf(row -> (row.get(column) == null) == negate);
                continue;
            }
            Matcher condition = CONDITION.matcher(clause);
            if (!condition.matches()) {
                throw new InMemorySqlException("unsupported condition: " + clause);
            }
            String column = key(condition.group(1));
            table.checkColumn(column);
            String op = condition.group(2);
            Object expected = value(condition.group(3), params);
            matched.removeIf(row -> !test(row.get(column), op, expected));
        }
        return matched;
    }

    private static List<Row> project(InMemoryTable table, List<Map<String, Object>> source, String projection, Params params) {
        List<Row> rows = new ArrayList<>();
        List<String> items = splitTopLevel(projection);
        for (Map<String, Object> row : source) {
            List<String> names = new ArrayList<>();
            List<Object> values = new ArrayList<>();
            for (String item : items) {
                String column = item.trim();
                if (column.equals("*")) {
                    names.addAll(table.columns());
                    table.columns().forEach(name -> values.add(row.get(name)));
                } else {
                    String name = key(column);
                    table.checkColumn(name);
                    names.add(name);
                    values.add(row.get(name));
                }
            }
            rows.add(new Row(names, values));
        }
        return rows;
    }

    private static boolean test(Object actual, String op, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        int comparison = compare(actual, expected);
        switch (op) {
            case "=": return comparison == 0;
            case "<>":
            case "!=": return comparison != 0;
            case "<": return comparison < 0;
            case ">": return comparison > 0;
            case "<=": return comparison <= 0;
            case ">=": return comparison >= 0;
            default: throw new InMemorySqlException("unsupported operator: " + op);
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof Comparable && a.getClass().isInstance(b)) {
            return ((Comparable) a).compareTo(b);
        }
        return a.toString().compareTo(b.toString());
    }

    private static int compareNullsLast(Object a, Object b) {
        if (a == null) return b == null ? 0 : 1;
        if (b == null) return -1;
        return compare(a, b);
    }

    private static Object arithmetic(Object current, String op, Object operand) {
        if (!(current instanceof Number) || !(operand instanceof Number)) {
            throw new InMemorySqlException("arithmetic on non-numeric value: " + current + " " + op + " " + operand);
        }
        Number left = (Number) current;
        Number right = (Number) operand;
        if (left instanceof Double || right instanceof Double) {
            double result = op.equals("+") ? left.doubleValue() + right.doubleValue() : left.doubleValue() - right.doubleValue();
            return result;
        }
        long result = op.equals("+") ? left.longValue() + right.longValue() : left.longValue() - right.longValue();
        if (left instanceof Integer && result >= Integer.MIN_VALUE && result <= Integer.MAX_VALUE) {
            return (int) result;
        }
        return result;
    }

    private static Object value(String token, Params params) {
        String text = token.trim();
        if (text.equals("?")) {
            return params.next();
        }
        if (text.equalsIgnoreCase("NULL")) {
            return null;
        }
        if (text.equalsIgnoreCase("TRUE")) {
            return Boolean.TRUE;
        }
        if (text.equalsIgnoreCase("FALSE")) {
            return Boolean.FALSE;
        }
        if (text.length() >= 2 && text.startsWith("'") && text.endsWith("'")) {
            return text.substring(1, text.length() - 1).replace("''", "'");
        }
        try {
            if (text.contains(".")) {
                return Double.parseDouble(text);
            }
            long number = Long.parseLong(text);
            if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
            return number;
        } catch (NumberFormatException e) {
            throw new InMemorySqlException("unsupported value expression: " + text);
        }
    }

    private static boolean isColumn(InMemoryTable table, String expression) {
        return expression.matches("\\w+") && table.columns().contains(key(expression));
    }

    private static String stripAlias(String item) {
        Matcher alias = ALIAS.matcher(item);
        return alias.matches() ? alias.group(1).trim() : item;
    }

    private static InMemoryTable table(Map<String, InMemoryTable> tables, String name) {
        InMemoryTable table = tables.get(key(name));
        if (table == null) {
            throw new InMemorySqlException("relation \"" + key(name) + "\" does not exist");
        }
        return table;
    }

    private static String key(String identifier) {
        return identifier.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Extracts the parenthesised tuples of a VALUES list.
     */
    private static List<String> tuples(String text) {
        List<String> tuples = new ArrayList<>();
        int depth = 0;
        int start = -1;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                if (depth++ == 0) {
                    start = i + 1;
                }
            } else if (!quoted && c == ')') {
                if (--depth == 0) {
                    tuples.add(text.substring(start, i));
                }
            }
        }
        if (tuples.isEmpty()) {
            throw new InMemorySqlException("VALUES list is empty: " + text);
        }
        return tuples;
    }

    /**
     * Splits on commas that are outside parentheses and quotes.
     */
    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
            } else if (!quoted && depth == 0 && c == ',') {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static final class Params {
        private final List<Object> values;
        private int position;

        Params(List<Object> values) {
            this.values = values;
        }

        Object next() {
            if (position >= values.size()) {
                throw new InMemorySqlException("statement references parameter " + (position + 1)
                    + " but only " + values.size() + " were bound");
            }
            return values.get(position++);
        }
    }
}
