package dev.mars.pgscope.pg;

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

import dev.mars.pgscope.api.query.CompiledStatement;
import dev.mars.pgscope.api.query.Query;
import dev.mars.pgscope.api.spi.Dialect;
import dev.mars.pgscope.api.transaction.TransactionOptions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL dialect.
 *
 * <p>Rewrites {@code ?} and {@code :name} placeholders into PostgreSQL's {@code $n} form. Text inside
 * string literals (including {@code E'...'} escape strings and {@code $tag$} dollar quoting), quoted
 * identifiers and comments is left alone, as are {@code ::} casts. A named
 * parameter used several times maps to one {@code $n}. Statements that already use {@code $n} pass
 * through unchanged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class PostgresDialect implements Dialect {

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public CompiledStatement compile(Query<?> query) {
        String sql = query.sql();
        StringBuilder out = new StringBuilder(sql.length() + 8);
        List<Object> params = new ArrayList<>();
        Map<String, Integer> namedIndexes = new LinkedHashMap<>();
        int positional = 0;

        int i = 0;
        int length = sql.length();
        while (i < length) {
            char c = sql.charAt(i);
            boolean wordStart = i == 0 || !isIdentifierPart(sql.charAt(i - 1));
            if ((c == 'E' || c == 'e') && wordStart && i + 1 < length && sql.charAt(i + 1) == '\'') {
                int end = skipEscapeString(sql, i + 1);
                out.append(sql, i, end);
                i = end;
            } else if (c == '$' && wordStart && dollarTagEnd(sql, i) > 0) {
                int tagEnd = dollarTagEnd(sql, i);
                String tag = sql.substring(i, tagEnd);
                int close = sql.indexOf(tag, tagEnd);
                int end = close < 0 ? length : close + tag.length();
                out.append(sql, i, end);
                i = end;
            } else if (c == '\'' || c == '"') {
                int end = skipQuoted(sql, i, c);
                out.append(sql, i, end);
                i = end;
            } else if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? length : end;
                out.append(sql, i, end);
                i = end;
            } else if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                end = end < 0 ? length : end + 2;
                out.append(sql, i, end);
                i = end;
            } else if (c == ':' && i + 1 < length && sql.charAt(i + 1) == ':') {
                out.append("::");
                i += 2;
            } else if (c == ':' && query.isNamed() && i + 1 < length && isIdentifierStart(sql.charAt(i + 1))) {
                int end = i + 1;
                while (end < length && isIdentifierPart(sql.charAt(end))) {
                    end++;
                }
                String name = sql.substring(i + 1, end);
                if (!query.namedParams().containsKey(name)) {
                    throw new IllegalArgumentException("No value bound for parameter :" + name + " in: " + sql);
                }
                Integer index = namedIndexes.get(name);
                if (index == null) {
                    params.add(query.namedParams().get(name));
                    index = params.size();
                    namedIndexes.put(name, index);
                }
                out.append('$').append(index);
                i = end;
            } else if (c == '?' && !query.isNamed()) {
                positional++;
                out.append('$').append(positional);
                i++;
            } else {
                out.append(c);
                i++;
            }
        }

        if (!query.isNamed()) {
            if (positional > 0 && positional != query.params().size()) {
                throw new IllegalArgumentException("Statement has " + positional + " placeholders but "
                    + query.params().size() + " parameters were given: " + sql);
            }
            return new CompiledStatement(out.toString(), query.params());
        }
        return new CompiledStatement(out.toString(), params);
    }

    /**
     * The statement that opens an outermost transaction with the given options.
     */
    public static String beginStatement(TransactionOptions options) {
        StringBuilder sql = new StringBuilder("BEGIN");
        if (options == null) {
            return sql.toString();
        }
        List<String> modes = new ArrayList<>();
        if (options.getIsolation() != null) {
            modes.add("ISOLATION LEVEL " + options.getIsolation().sql());
        }
        if (options.getReadOnly() != null) {
            modes.add(options.getReadOnly() ? "READ ONLY" : "READ WRITE");
        }
        if (options.getDeferrable() != null) {
            modes.add(options.getDeferrable() ? "DEFERRABLE" : "NOT DEFERRABLE");
        }
        if (!modes.isEmpty()) {
            sql.append(' ').append(String.join(", ", modes));
        }
        return sql.toString();
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    // E'...' strings accept backslash escapes as well as doubled quotes
    private static int skipEscapeString(String sql, int quoteIndex) {
        int i = quoteIndex + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '\'') {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    /**
     * End index (exclusive) of a dollar-quote opening tag such as {@code $$} or {@code $body$}
     * starting at {@code start}, or {@code -1}. {@code $1} is a parameter, not a tag.
     */
    private static int dollarTagEnd(String sql, int start) {
        int i = start + 1;
        if (i < sql.length() && sql.charAt(i) == '$') {
            return i + 1;
        }
        if (i >= sql.length() || !isIdentifierStart(sql.charAt(i))) {
            return -1;
        }
        while (i < sql.length() && isIdentifierPart(sql.charAt(i))) {
            i++;
        }
        return i < sql.length() && sql.charAt(i) == '$' ? i + 1 : -1;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
