package org.pak.brefv.payloads;

import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.DescriptorValidationException;
import com.google.protobuf.Descriptors.FileDescriptor;
import com.google.protobuf.Timestamp;
import org.pak.brefv.core.error.UnknownMessageTypeException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Message descriptors of known payload types, looked up by fully-qualified type name.
 *
 * <p>{@link #PRIMITIVES} describes the {@code keelson.Timestamped*} family: every type carries a
 * {@code google.protobuf.Timestamp timestamp = 1} and a typed {@code value = 2}.
 */
public class PayloadTypes {
    public static final FileDescriptor PRIMITIVES_FILE = buildPrimitives();
    public static final PayloadTypes PRIMITIVES = of(PRIMITIVES_FILE);

    private final Map<String, Descriptor> descriptorsByName;

    private PayloadTypes(Map<String, Descriptor> descriptorsByName) {
        this.descriptorsByName = Collections.unmodifiableMap(descriptorsByName);
    }

    /**
     * Registers every message of the given files and of their transitive dependencies.
     */
    public static PayloadTypes of(FileDescriptor... files) {
        var descriptors = new LinkedHashMap<String, Descriptor>();
        for (var file : files) {
            collect(file, descriptors);
        }
        return new PayloadTypes(descriptors);
    }

    /**
     * @throws UnknownMessageTypeException if no registered file defines {@code typeName}
     */
    public Descriptor descriptor(String typeName) {
        var descriptor = descriptorsByName.get(typeName);
        if (descriptor == null) {
            throw new UnknownMessageTypeException(typeName);
        }
        return descriptor;
    }

    public boolean contains(String typeName) {
        return descriptorsByName.containsKey(typeName);
    }

    public Set<String> typeNames() {
        return descriptorsByName.keySet();
    }

    /**
     * New registry holding the types of both. Fails if the two define a type name differently.
     */
    public PayloadTypes extend(PayloadTypes other) {
        var descriptors = new LinkedHashMap<>(descriptorsByName);
        other.descriptorsByName.values().forEach(descriptor -> register(descriptor, descriptors));
        return new PayloadTypes(descriptors);
    }

    private static void collect(FileDescriptor file, Map<String, Descriptor> descriptors) {
        for (var dependency : file.getDependencies()) {
            collect(dependency, descriptors);
        }
        for (var messageType : file.getMessageTypes()) {
            collect(messageType, descriptors);
        }
    }

    private static void collect(Descriptor descriptor, Map<String, Descriptor> descriptors) {
        register(descriptor, descriptors);
        for (var nested : descriptor.getNestedTypes()) {
            collect(nested, descriptors);
        }
    }

    private static void register(Descriptor descriptor, Map<String, Descriptor> descriptors) {
        var previous = descriptors.putIfAbsent(descriptor.getFullName(), descriptor);
        if (previous != null && previous != descriptor && !previous.toProto().equals(descriptor.toProto())) {
            throw new IllegalArgumentException("Type " + descriptor.getFullName() + " is already registered from "
                    + previous.getFile().getName() + ", cannot register a different definition from "
                    + descriptor.getFile().getName());
        }
    }

    private static FileDescriptor buildPrimitives() {
        var file = FileDescriptorProto.newBuilder()
                .setName("keelson/Primitives.proto")
                .setPackage("keelson")
                .setSyntax("proto3")
                .addDependency(Timestamp.getDescriptor().getFile().getName())
                .addMessageType(timestamped("TimestampedBytes", FieldDescriptorProto.Type.TYPE_BYTES))
                .addMessageType(timestamped("TimestampedString", FieldDescriptorProto.Type.TYPE_STRING))
                .addMessageType(timestamped("TimestampedFloat", FieldDescriptorProto.Type.TYPE_FLOAT))
                .addMessageType(timestamped("TimestampedDouble", FieldDescriptorProto.Type.TYPE_DOUBLE))
                .addMessageType(timestamped("TimestampedInt", FieldDescriptorProto.Type.TYPE_INT32))
                .addMessageType(timestamped("TimestampedBool", FieldDescriptorProto.Type.TYPE_BOOL))
                .build();

        try {
            return FileDescriptor.buildFrom(file, new FileDescriptor[]{Timestamp.getDescriptor().getFile()});
        } catch (DescriptorValidationException e) {
            throw new IllegalStateException("Primitive payload descriptors are invalid", e);
        }
    }

    private static DescriptorProto timestamped(String name, FieldDescriptorProto.Type valueType) {
        return DescriptorProto.newBuilder()
                .setName(name)
                .addField(FieldDescriptorProto.newBuilder()
                        .setName("timestamp")
                        .setJsonName("timestamp")
                        .setNumber(1)
                        .setLabel(FieldDescriptorProto.Label.LABEL_OPTIONAL)
                        .setType(FieldDescriptorProto.Type.TYPE_MESSAGE)
                        .setTypeName("." + Timestamp.getDescriptor().getFullName()))
                .addField(FieldDescriptorProto.newBuilder()
                        .setName("value")
                        .setJsonName("value")
                        .setNumber(2)
                        .setLabel(FieldDescriptorProto.Label.LABEL_OPTIONAL)
                        .setType(valueType))
                .build();
    }
}
