package org.pak.brefv.payloads;

import com.google.protobuf.ByteString;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.util.JsonFormat;
import org.pak.brefv.core.error.MalformedPayloadException;

/**
 * Decodes payload bytes and JSON into messages of a type known only by name at runtime.
 */
public class PayloadCodec {
    private final PayloadTypes payloadTypes;
    private final JsonFormat.Printer printer;
    private final JsonFormat.Parser parser;

    public PayloadCodec(PayloadTypes payloadTypes) {
        this.payloadTypes = payloadTypes;
        this.printer = JsonFormat.printer()
                .preservingProtoFieldNames()
                .includingDefaultValueFields()
                .printingEnumsAsInts()
                .omittingInsignificantWhitespace();
        this.parser = JsonFormat.parser();
    }

    public PayloadCodec() {
        this(PayloadTypes.PRIMITIVES);
    }

    public PayloadTypes payloadTypes() {
        return payloadTypes;
    }

    public DynamicMessage.Builder newBuilder(String typeName) {
        return DynamicMessage.newBuilder(payloadTypes.descriptor(typeName));
    }

    /**
     * @throws org.pak.brefv.core.error.UnknownMessageTypeException if the type is not registered
     * @throws MalformedPayloadException                           if the bytes do not parse as that type
     */
    public DynamicMessage decode(ByteString payload, String typeName) {
        var descriptor = payloadTypes.descriptor(typeName);
        try {
            return DynamicMessage.parseFrom(descriptor, payload);
        } catch (InvalidProtocolBufferException e) {
            throw new MalformedPayloadException("Payload is not a valid " + typeName + ": " + e.getMessage(), e);
        }
    }

    public DynamicMessage decode(byte[] payload, String typeName) {
        return decode(ByteString.copyFrom(payload), typeName);
    }

    public DynamicMessage fromJson(String json, String typeName) {
        var builder = newBuilder(typeName);
        try {
            parser.merge(json, builder);
        } catch (InvalidProtocolBufferException e) {
            throw new MalformedPayloadException("JSON is not a valid " + typeName + ": " + e.getMessage(), e);
        }
        return builder.build();
    }

    public String toJson(Message message) {
        try {
            return printer.print(message);
        } catch (InvalidProtocolBufferException e) {
            throw new MalformedPayloadException("Cannot print " + message.getDescriptorForType().getFullName()
                    + " as JSON: " + e.getMessage(), e);
        }
    }
}
