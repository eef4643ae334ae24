package com.jumpad.mathapi.converter;

import com.jumpad.mathapi.exception.InputTypeException;
import com.jumpad.mathapi.exception.InputValueException;
import com.jumpad.mathapi.model.NumericList;
import com.jumpad.mathapi.model.Operation;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Standard implementation of {@link NumericCoercer}.
 *
 * <p>Floating-point and textual values go through {@link BigDecimal} and
 * {@link BigInteger} so that range and fraction checks are exact: a double such as
 * {@code 1e19} is rejected as out of range instead of being silently clamped by a
 * narrowing cast.</p>
 *
 * <h2>Thread Safety:</h2>
 * <p>Stateless and thread-safe.</p>
 *
 * @version 1.0.0
 */
@Component
public class StandardNumericCoercer implements NumericCoercer {

    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?[0-9]+");

    /**
     * Digits in Long.MIN_VALUE / Long.MAX_VALUE. Anything with more integer
     * digits is out of range without further arithmetic.
     */
    private static final int MAX_LONG_DIGITS = 19;

    @Override
    public NumericList coerce(Object raw, Operation operation) {
        if (!(raw instanceof List<?> items)) {
            throw new InputTypeException(String.format(
                "Erro de tipo na operação de %s: O campo 'numeros' deve ser uma lista, mas foi fornecido '%s'.",
                operation.label(), describeType(raw)));
        }

        List<Long> values = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            values.add(coerceElement(items.get(i), i + 1, operation));
        }
        return new NumericList(values);
    }

    /**
     * Coerces a single element.
     *
     * @param item      the element
     * @param position  1-based position, for error messages
     * @param operation the target operation, for error messages
     * @return the element as a long
     */
    private long coerceElement(Object item, int position, Operation operation) {
        if (item == null) {
            throw valueError(operation, position, "não pode ser nulo");
        }
        if (item instanceof Integer || item instanceof Long
                || item instanceof Short || item instanceof Byte) {
            return ((Number) item).longValue();
        }
        if (item instanceof BigInteger bigInteger) {
            return fromBigInteger(bigInteger, item, position, operation);
        }
        if (item instanceof Double || item instanceof Float) {
            double value = ((Number) item).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw valueError(operation, position, item, "não é um número finito");
            }
            return fromDecimal(new BigDecimal(value), item, position, operation);
        }
        if (item instanceof BigDecimal decimal) {
            return fromDecimal(decimal, item, position, operation);
        }
        if (item instanceof String text) {
            if (!INTEGER_TEXT.matcher(text).matches()) {
                throw valueError(operation, position, item,
                    "não é um inteiro válido e não pode ser convertido para inteiro");
            }
            return fromBigInteger(new BigInteger(text), item, position, operation);
        }
        throw valueError(operation, position, item,
            "não é um inteiro válido. Tipo encontrado: '" + describeType(item) + "'");
    }

    private long fromDecimal(BigDecimal decimal, Object item, int position, Operation operation) {
        BigDecimal normalized = decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
        if (normalized.scale() > 0) {
            throw valueError(operation, position, item,
                "não é um inteiro válido e a conversão resultaria em perda de informação. Forneça apenas inteiros");
        }
        if (normalized.precision() - normalized.scale() > MAX_LONG_DIGITS) {
            throw outOfRange(operation, position, item);
        }
        return fromBigInteger(normalized.toBigIntegerExact(), item, position, operation);
    }

    private long fromBigInteger(BigInteger value, Object item, int position, Operation operation) {
        if (value.bitLength() > Long.SIZE - 1) {
            throw outOfRange(operation, position, item);
        }
        return value.longValue();
    }

    private InputValueException outOfRange(Operation operation, int position, Object item) {
        return valueError(operation, position, item, "está fora do intervalo de inteiros de 64 bits");
    }

    private InputValueException valueError(Operation operation, int position, Object item, String rule) {
        return valueError(operation, position, "('" + item + "') " + rule);
    }

    private InputValueException valueError(Operation operation, int position, String detail) {
        return new InputValueException(String.format(
            "Erro de valor na operação de %s: Elemento na posição %d %s.",
            operation.label(), position, detail));
    }

    private static String describeType(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof List) {
            return "lista";
        }
        if (value instanceof Map) {
            return "objeto";
        }
        if (value instanceof String) {
            return "texto";
        }
        if (value instanceof Boolean) {
            return "booleano";
        }
        if (value instanceof Number) {
            return "número";
        }
        return value.getClass().getSimpleName();
    }
}
