package org.pak.brefv.payloads;

import com.google.protobuf.DynamicMessage;

import java.time.Instant;

public record DecodedEnvelope(Instant receivedAt, Instant enclosedAt, String typeName, DynamicMessage payload) {
}
