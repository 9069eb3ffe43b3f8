package com.ruchira.nest.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes a null map key as the text "null", the way a JSON null group value reads back.
 */
public class NullKeySerializer extends StdSerializer<Object> {

    public static final String NULL_KEY = "null";

    public NullKeySerializer() {
        super(Object.class);
    }

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeFieldName(NULL_KEY);
    }
}
