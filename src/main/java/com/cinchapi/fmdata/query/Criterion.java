/*
 * Copyright (c) 2013-2025 Cinchapi Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.cinchapi.fmdata.query;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.ValidationException;
import com.cinchapi.fmdata.model.Codec;
import com.cinchapi.fmdata.model.DefaultCodec;
import com.cinchapi.fmdata.model.FieldType;
import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * A condition on a single field of a find request: an {@link Operator} and
 * its operands.
 * <p>
 * Operands are checked against the operator when the criterion is created, so
 * a malformed condition fails before any request is sent. Comparisons accept
 * numbers and temporal values, a range takes exactly two bounds and the
 * {@link Operator#EMPTY empty}, {@link Operator#NOT_EMPTY not empty} and
 * {@link Operator#BLANK blank} operators take none.
 * </p>
 * <p>
 * When {@link #encode() encoded}, the characters that the remote find syntax
 * treats specially are escaped with a backslash. Only a {@link #raw(String)
 * raw} criterion is sent verbatim.
 * </p>
 *
 * @author Jeff Nelson
 */
@Immutable
public final class Criterion {

    /**
     * The characters that have a meaning in the find syntax.
     */
    private static final CharMatcher SPECIAL_CHARS = CharMatcher
            .anyOf("@*#?!=<>\"");

    /**
     * Return a {@link Criterion} for {@code operator} and a {@code value}
     * given in a lookup. A {@link Operator#RANGE range} expects a two element
     * {@link Collection} or array.
     *
     * @param operator
     * @param value
     * @return the criterion
     * @throws ValidationException if {@code value} does not fit the
     *             {@code operator}
     */
    public static Criterion of(Operator operator, Object value) {
        switch (operator) {
        case RANGE:
            List<Object> bounds;
            if(value instanceof Collection) {
                bounds = new ArrayList<>((Collection<?>) value);
            }
            else if(value instanceof Object[]) {
                bounds = Arrays.asList((Object[]) value);
            }
            else {
                throw ValidationException.format(
                        "A range needs a pair of bounds, not {}", value);
            }
            if(bounds.size() != 2) {
                throw ValidationException.format(
                        "A range needs exactly two bounds, not {}", bounds);
            }
            return range(bounds.get(0), bounds.get(1));
        case RAW:
            if(!(value instanceof String)) {
                throw ValidationException.format(
                        "A raw criterion needs a String, not {}", value);
            }
            return raw((String) value);
        case EMPTY:
        case NOT_EMPTY:
        case BLANK:
            throw ValidationException.format(
                    "The {} operator does not take a value", operator);
        default:
            return new Criterion(operator, operands(value), true);
        }
    }

    public static Criterion exact(Object value) {
        return new Criterion(Operator.EXACT, operands(value), true);
    }

    public static Criterion startsWith(Object value) {
        return new Criterion(Operator.STARTS_WITH, operands(value),
                true);
    }

    public static Criterion endsWith(Object value) {
        return new Criterion(Operator.ENDS_WITH, operands(value),
                true);
    }

    public static Criterion contains(Object value) {
        return new Criterion(Operator.CONTAINS, operands(value), true);
    }

    public static Criterion gt(Object value) {
        return new Criterion(Operator.GT, operands(value), true);
    }

    public static Criterion gte(Object value) {
        return new Criterion(Operator.GTE, operands(value), true);
    }

    public static Criterion lt(Object value) {
        return new Criterion(Operator.LT, operands(value), true);
    }

    public static Criterion lte(Object value) {
        return new Criterion(Operator.LTE, operands(value), true);
    }

    /**
     * Return a {@link Criterion} that matches values between {@code from} and
     * {@code to}, inclusive.
     *
     * @param from
     * @param to
     * @return the criterion
     */
    public static Criterion range(Object from, Object to) {
        return new Criterion(Operator.RANGE, operands(from, to), true);
    }

    /**
     * Return a {@link Criterion} that sends {@code expression} as is.
     *
     * @param expression
     * @return the criterion
     */
    public static Criterion raw(String expression) {
        return raw(expression, false);
    }

    /**
     * Return a {@link Criterion} that sends {@code expression}, escaped if
     * {@code escape} is {@code true}.
     *
     * @param expression
     * @param escape
     * @return the criterion
     */
    public static Criterion raw(String expression, boolean escape) {
        return new Criterion(Operator.RAW, operands(expression),
                escape);
    }

    /**
     * Return a {@link Criterion} that matches an empty field.
     *
     * @return the criterion
     */
    public static Criterion empty() {
        return new Criterion(Operator.EMPTY, ImmutableList.of(), false);
    }

    /**
     * Return a {@link Criterion} that matches any non-empty field.
     *
     * @return the criterion
     */
    public static Criterion notEmpty() {
        return new Criterion(Operator.NOT_EMPTY, ImmutableList.of(), false);
    }

    public static Criterion blank() {
        return new Criterion(Operator.BLANK, ImmutableList.of(), false);
    }

    /**
     * Return {@code text} with every special character escaped.
     *
     * @param text
     * @return the escaped text
     */
    static String escape(String text) {
        if(SPECIAL_CHARS.matchesNoneOf(text)) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (char c : text.toCharArray()) {
            if(SPECIAL_CHARS.matches(c)) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Return {@code true} if {@code value} can be compared by order.
     *
     * @param value
     * @return a boolean
     */
    private static boolean isOrdered(Object value) {
        return value instanceof Number || value instanceof Temporal;
    }

    /**
     * Return the operand list; nulls are kept so that {@link #check()} can
     * reject them.
     *
     * @param values
     * @return the operands
     */
    private static List<Object> operands(Object... values) {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    private final Operator operator;
    private final List<Object> operands;
    private final boolean escape;

    /**
     * Construct a new instance.
     *
     * @param operator
     * @param operands
     * @param escape
     */
    private Criterion(Operator operator, List<Object> operands,
            boolean escape) {
        this.operator = operator;
        this.operands = operands;
        this.escape = escape;
        check();
    }

    /**
     * Return the text of this criterion in the find syntax. Operands are
     * formatted with {@link DefaultCodec#formatOperand(Object)}.
     *
     * @return the text
     */
    public String encode() {
        return encode(DefaultCodec::formatOperand);
    }

    /**
     * Return the text of this criterion in the find syntax for a field of the
     * {@code type}, with operands encoded by the {@code codec}.
     *
     * @param codec
     * @param type
     * @return the text
     */
    public String encode(Codec codec, FieldType type) {
        return encode(operand -> DefaultCodec
                .formatOperand(codec.encode(type, operand)));
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof Criterion) {
            Criterion other = (Criterion) obj;
            return operator == other.operator
                    && operands.equals(other.operands)
                    && escape == other.escape;
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operands, escape);
    }

    public List<Object> operands() {
        return operands;
    }

    public Operator operator() {
        return operator;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("operator", operator)
                .add("operands", operands).toString();
    }

    /**
     * Throw a {@link ValidationException} if the {@link #operands} do not fit
     * the {@link #operator}.
     */
    private void check() {
        for (Object operand : operands) {
            if(operand == null) {
                throw ValidationException.format(
                        "The {} operator does not accept null; use an empty "
                                + "criterion instead",
                        operator);
            }
        }
        switch (operator) {
        case GT:
        case GTE:
        case LT:
        case LTE:
            if(!isOrdered(operands.get(0))) {
                throw ValidationException.format(
                        "The {} operator needs a number, date or time, not {}",
                        operator, operands.get(0).getClass().getSimpleName());
            }
            break;
        case RANGE:
            for (Object bound : operands) {
                if(!isOrdered(bound) && !(bound instanceof String)) {
                    throw ValidationException.format(
                            "A range bound must be a number, date, time or "
                                    + "text, not {}",
                            bound.getClass().getSimpleName());
                }
            }
            break;
        default:
            break;
        }
    }

    /**
     * Return the text of this criterion with operands turned into text by
     * {@code formatter}.
     *
     * @param formatter
     * @return the text
     */
    private String encode(Function<Object, String> formatter) {
        switch (operator) {
        case EXACT:
            return "==" + text(0, formatter);
        case STARTS_WITH:
            return "==" + text(0, formatter) + "*";
        case ENDS_WITH:
            return "==*" + text(0, formatter);
        case CONTAINS:
            return "==*" + text(0, formatter) + "*";
        case GT:
            return ">" + text(0, formatter);
        case GTE:
            return ">=" + text(0, formatter);
        case LT:
            return "<" + text(0, formatter);
        case LTE:
            return "<=" + text(0, formatter);
        case RANGE:
            return text(0, formatter) + "..." + text(1, formatter);
        case RAW:
            return text(0, formatter);
        case EMPTY:
            return "==";
        case BLANK:
            return "=";
        case NOT_EMPTY:
            return "*";
        default:
            throw new IllegalStateException(operator.name());
        }
    }

    /**
     * Return the text of the operand at {@code index}.
     *
     * @param index
     * @param formatter
     * @return the text
     */
    private String text(int index, Function<Object, String> formatter) {
        String text = formatter.apply(operands.get(index));
        return escape ? escape(text) : text;
    }

}
