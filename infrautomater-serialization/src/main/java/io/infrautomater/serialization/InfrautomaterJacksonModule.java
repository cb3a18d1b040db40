package io.infrautomater.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.infrautomater.core.request.RequestStatus;
import java.io.IOException;
import java.io.Serial;

/// Jackson `SimpleModule` that registers infrautomater type handlers in one place.
///
/// - `RequestStatus` is written as its lowercase wire value (`"provisioning"`)
///   and read case-insensitively; unknown values fail deserialization
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see InfrautomaterSerializer for the convenience factory API
public class InfrautomaterJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3417706212952390561L;

    public InfrautomaterJacksonModule() {
        super("InfrautomaterJacksonModule");
        addSerializer(RequestStatus.class, new RequestStatusSerializer());
        addDeserializer(RequestStatus.class, new RequestStatusDeserializer());
    }

    static final class RequestStatusSerializer extends StdSerializer<RequestStatus> {

        @Serial private static final long serialVersionUID = -2405018870393393124L;

        RequestStatusSerializer() {
            super(RequestStatus.class);
        }

        @Override
        public void serialize(RequestStatus value, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            gen.writeString(value.value());
        }
    }

    static final class RequestStatusDeserializer extends StdDeserializer<RequestStatus> {

        @Serial private static final long serialVersionUID = 8862734109525601307L;

        RequestStatusDeserializer() {
            super(RequestStatus.class);
        }

        @Override
        public RequestStatus deserialize(JsonParser p, DeserializationContext ctxt)
                throws IOException {
            String raw = p.getValueAsString();
            return RequestStatus.fromValue(raw)
                    .orElseThrow(
                            () ->
                                    ctxt.weirdStringException(
                                            raw, RequestStatus.class, "unknown request status"));
        }
    }
}
