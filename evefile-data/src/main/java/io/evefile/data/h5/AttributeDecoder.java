package io.evefile.data.h5;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.jhdf.api.Attribute;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.Array;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// Turns HDF5 attribute values into text.
///
/// Measurement files store attributes as fixed-length strings, sometimes as one-element
/// string arrays and occasionally as numbers. Older files were written in Latin-1 while
/// claiming ASCII, so strings that do not decode cleanly are decoded again from the raw
/// bytes with a fallback charset.
public final class AttributeDecoder {

    private static final Logger logger = LogManager.getLogger(AttributeDecoder.class);
    private static final char REPLACEMENT = '\uFFFD';

    private final Charset fallback;

    public AttributeDecoder() {
        this(StandardCharsets.ISO_8859_1);
    }

    public AttributeDecoder(Charset fallback) {
        this.fallback = fallback == null ? StandardCharsets.ISO_8859_1 : fallback;
    }

    public Charset getFallback() {
        return fallback;
    }

    /// @param attribute a jhdf attribute
    /// @return the attribute value as text
    public String decode(Attribute attribute) {
        String text = decodeValue(attribute.getData());
        if (text.indexOf(REPLACEMENT) < 0) {
            return text;
        }
        String redecoded = redecode(attribute.getBuffer());
        logger.debug("Re-decoded attribute {} as {}: '{}'", attribute.getName(), fallback, redecoded);
        return redecoded;
    }

    /// Render an attribute value read by jhdf as text. Arrays yield their first element.
    /// @param value a string, number or array of them
    /// @return the text, empty for null or empty arrays
    public static String decodeValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8).trim();
        }
        if (value.getClass().isArray()) {
            if (Array.getLength(value) == 0) {
                return "";
            }
            return decodeValue(Array.get(value, 0));
        }
        return String.valueOf(value).trim();
    }

    /// Decode raw string bytes with the fallback charset, up to the first NUL.
    /// @param buffer the raw attribute bytes
    /// @return the decoded text
    public String redecode(ByteBuffer buffer) {
        ByteBuffer view = buffer.duplicate();
        byte[] bytes = new byte[view.remaining()];
        view.get(bytes);
        int end = 0;
        while (end < bytes.length && bytes[end] != 0) {
            end++;
        }
        return new String(Arrays.copyOf(bytes, end), fallback).trim();
    }
}
