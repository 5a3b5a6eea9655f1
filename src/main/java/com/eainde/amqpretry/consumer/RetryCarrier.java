package com.eainde.amqpretry.consumer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Carries a payload of any shape through the retry consumer so it can be handed back to its original
 * destination without knowing its type. Decoding only checks that the body is well-formed JSON;
 * the body itself is kept byte for byte and republished as is.
 */
@JsonDeserialize(using = RetryCarrier.Deserializer.class)
@JsonSerialize(using = RetryCarrier.Serializer.class)
public final class RetryCarrier implements RawBodyReceiver {

    private static final byte[] EMPTY = new byte[0];

    private byte[] body = EMPTY;

    public RetryCarrier() {
    }

    RetryCarrier(byte[] body) {
        this.body = body;
    }

    @Override
    public void receiveRawBody(byte[] body) {
        this.body = body;
    }

    public byte[] body() {
        return body;
    }

    public String json() {
        return body.length == 0 ? "null" : new String(body, StandardCharsets.UTF_8);
    }

    public static class Deserializer extends StdDeserializer<RetryCarrier> {

        public Deserializer() {
            super(RetryCarrier.class);
        }

        @Override
        public RetryCarrier deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            p.skipChildren();
            return new RetryCarrier();
        }

        @Override
        public RetryCarrier deserialize(JsonParser p, DeserializationContext ctxt, RetryCarrier intoValue) throws IOException {
            p.skipChildren();
            return intoValue;
        }
    }

    public static class Serializer extends StdSerializer<RetryCarrier> {

        public Serializer() {
            super(RetryCarrier.class);
        }

        @Override
        public void serialize(RetryCarrier value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeRawValue(value.json());
        }
    }
}
