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
package com.cinchapi.fmdata.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.cinchapi.common.base.AnyStrings;
import com.cinchapi.fmdata.ValidationException;

/**
 * The {@link Codec} for the formats the remote service uses by default: US
 * dates ({@code MM/dd/yyyy}), timestamps ({@code MM/dd/yyyy HH:mm:ss}), times
 * ({@code HH:mm:ss}) and booleans stored as {@code 1} or {@code 0}.
 * <p>
 * A {@link String} is always encoded unchanged because it is taken to be in
 * the remote format already. {@code null} is encoded as the empty string,
 * which clears the field, and the empty string decodes to {@code null}.
 * </p>
 *
 * @author Jeff Nelson
 */
@Immutable
public class DefaultCodec implements Codec {

    /**
     * The format of date values.
     */
    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter
            .ofPattern("MM/dd/yyyy");

    /**
     * The format of timestamp values.
     */
    public static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter
            .ofPattern("MM/dd/yyyy HH:mm:ss");

    /**
     * The format of time values.
     */
    public static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter
            .ofPattern("HH:mm:ss");

    /**
     * Return the text that represents {@code value} in a find request.
     *
     * @param value
     * @return the text
     */
    public static String formatOperand(Object value) {
        if(value instanceof String) {
            return (String) value;
        }
        else if(value instanceof Boolean) {
            return (Boolean) value ? "1" : "0";
        }
        else if(value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        else if(value instanceof LocalDate) {
            return DATE_FORMAT.format((LocalDate) value);
        }
        else if(value instanceof LocalDateTime) {
            return DATETIME_FORMAT.format((LocalDateTime) value);
        }
        else if(value instanceof LocalTime) {
            return TIME_FORMAT.format((LocalTime) value);
        }
        else {
            return value.toString();
        }
    }

    /**
     * Return a {@link ValidationException} for a value that does not fit the
     * {@code type}.
     *
     * @param type
     * @param value
     * @return the exception
     */
    private static ValidationException mismatch(FieldType type,
            Object value) {
        return ValidationException.format("{} is not a valid {} value", value,
                type);
    }

    /**
     * Return {@code value} as a {@link BigDecimal}.
     *
     * @param value
     * @return the decimal
     */
    private static BigDecimal toBigDecimal(Object value) {
        if(value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        else {
            return new BigDecimal(value.toString().trim());
        }
    }

    @Override
    public Object encode(FieldType type, @Nullable Object value) {
        if(value == null) {
            return "";
        }
        else if(value instanceof String) {
            return value;
        }
        switch (type) {
        case STRING:
            return value.toString();
        case INTEGER:
            if(value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte
                    || value instanceof BigInteger) {
                return ((Number) value).longValue();
            }
            break;
        case FLOAT:
            if(value instanceof Number) {
                return ((Number) value).doubleValue();
            }
            break;
        case DECIMAL:
            if(value instanceof Number) {
                return toBigDecimal(value);
            }
            break;
        case BOOL:
            if(value instanceof Boolean) {
                return (Boolean) value ? 1 : 0;
            }
            break;
        case DATE:
            if(value instanceof LocalDate) {
                return DATE_FORMAT.format((LocalDate) value);
            }
            break;
        case DATETIME:
            if(value instanceof LocalDateTime) {
                return DATETIME_FORMAT.format((LocalDateTime) value);
            }
            break;
        case TIME:
            if(value instanceof LocalTime) {
                return TIME_FORMAT.format((LocalTime) value);
            }
            break;
        default:
            break;
        }
        throw mismatch(type, value);
    }

    @Override
    @Nullable
    public Object decode(FieldType type, @Nullable Object value) {
        if(value == null || "".equals(value)) {
            return null;
        }
        try {
            switch (type) {
            case STRING:
                return value instanceof BigDecimal
                        ? ((BigDecimal) value).toPlainString()
                        : value.toString();
            case INTEGER:
                return toBigDecimal(value).longValueExact();
            case FLOAT:
                return toBigDecimal(value).doubleValue();
            case DECIMAL:
                return toBigDecimal(value);
            case BOOL:
                if(value instanceof Boolean) {
                    return value;
                }
                else if(value instanceof BigDecimal) {
                    return ((BigDecimal) value).signum() != 0;
                }
                else {
                    String text = value.toString().trim();
                    return text.equals("1") || text.equalsIgnoreCase("true");
                }
            case DATE:
                return LocalDate.parse(value.toString(), DATE_FORMAT);
            case DATETIME:
                return LocalDateTime.parse(value.toString(), DATETIME_FORMAT);
            case TIME:
                return LocalTime.parse(value.toString(), TIME_FORMAT);
            case CONTAINER:
                return value.toString();
            default:
                throw mismatch(type, value);
            }
        }
        catch (NumberFormatException | ArithmeticException
                | DateTimeParseException e) {
            throw new ValidationException(AnyStrings.format(
                    "Cannot read {} as a {} value", value, type), e);
        }
    }

}
