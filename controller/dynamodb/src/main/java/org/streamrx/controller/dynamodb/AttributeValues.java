/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.streamrx.controller.dynamodb;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.*;

/**
 * Converts between DynamoDB {@link AttributeValue}s and plain Java values.
 * <p>
 * Strings, booleans and {@code null} map to themselves. Numbers become {@link Long} if they're integral and fit, otherwise
 * {@link BigDecimal}. Binary values become {@code byte[]}, maps and lists are converted recursively and string, number and
 * binary sets become {@link Set}s.
 * </p>
 */
@NullMarked
public final class AttributeValues {

    private AttributeValues() {
    }

    public static Map<String, Object> toMap(@Nullable Map<String, AttributeValue> item) {
        if (item == null) {
            return Map.of();
        }
        Map<String, Object> map = new LinkedHashMap<>();
        item.forEach((name, value) -> map.put(name, toObject(value)));
        return map;
    }

    public static Map<String, AttributeValue> fromMap(Map<String, Object> map) {
        Map<String, AttributeValue> item = new LinkedHashMap<>();
        map.forEach((name, value) -> item.put(name, fromObject(value)));
        return item;
    }

    public static @Nullable Object toObject(AttributeValue value) {
        if (value.s() != null) {
            return value.s();
        } else if (value.n() != null) {
            return toNumber(value.n());
        } else if (value.bool() != null) {
            return value.bool();
        } else if (Boolean.TRUE.equals(value.nul())) {
            return null;
        } else if (value.b() != null) {
            return value.b().asByteArray();
        } else if (value.hasM()) {
            return toMap(value.m());
        } else if (value.hasL()) {
            List<Object> list = new ArrayList<>();
            value.l().forEach(element -> list.add(toObject(element)));
            return list;
        } else if (value.hasSs()) {
            return new LinkedHashSet<>(value.ss());
        } else if (value.hasNs()) {
            Set<Object> numbers = new LinkedHashSet<>();
            value.ns().forEach(n -> numbers.add(toNumber(n)));
            return numbers;
        } else if (value.hasBs()) {
            Set<Object> binaries = new LinkedHashSet<>();
            value.bs().forEach(b -> binaries.add(b.asByteArray()));
            return binaries;
        }
        throw new IllegalArgumentException("Unsupported attribute value: " + value);
    }

    public static AttributeValue fromObject(@Nullable Object value) {
        if (value == null) {
            return AttributeValue.builder().nul(true).build();
        } else if (value instanceof String s) {
            return AttributeValue.builder().s(s).build();
        } else if (value instanceof Number number) {
            return AttributeValue.builder().n(toNumberString(number)).build();
        } else if (value instanceof Boolean bool) {
            return AttributeValue.builder().bool(bool).build();
        } else if (value instanceof byte[] bytes) {
            return AttributeValue.builder().b(SdkBytes.fromByteArray(bytes)).build();
        } else if (value instanceof ByteBuffer buffer) {
            return AttributeValue.builder().b(SdkBytes.fromByteBuffer(buffer)).build();
        } else if (value instanceof SdkBytes bytes) {
            return AttributeValue.builder().b(bytes).build();
        } else if (value instanceof Map<?, ?> map) {
            Map<String, AttributeValue> m = new LinkedHashMap<>();
            map.forEach((k, v) -> m.put(String.valueOf(k), fromObject(v)));
            return AttributeValue.builder().m(m).build();
        } else if (value instanceof Set<?> set && !set.isEmpty() && set.stream().allMatch(String.class::isInstance)) {
            return AttributeValue.builder().ss(set.stream().map(String.class::cast).toList()).build();
        } else if (value instanceof Set<?> set && !set.isEmpty() && set.stream().allMatch(Number.class::isInstance)) {
            return AttributeValue.builder().ns(set.stream().map(n -> toNumberString((Number) n)).toList()).build();
        } else if (value instanceof Collection<?> collection) {
            return AttributeValue.builder().l(collection.stream().map(AttributeValues::fromObject).toList()).build();
        }
        throw new IllegalArgumentException("Cannot convert " + value.getClass().getName() + " to an attribute value");
    }

    private static Number toNumber(String n) {
        BigDecimal decimal = new BigDecimal(n);
        if (decimal.scale() <= 0 || decimal.stripTrailingZeros().scale() <= 0) {
            BigInteger integer = decimal.toBigIntegerExact();
            if (integer.bitLength() < 64) {
                return integer.longValue();
            }
        }
        return decimal;
    }

    private static String toNumberString(Number number) {
        return number instanceof BigDecimal decimal ? decimal.toPlainString() : number.toString();
    }
}
