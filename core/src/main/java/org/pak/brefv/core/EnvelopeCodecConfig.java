package org.pak.brefv.core;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.FieldDefaults;

@Builder
@FieldDefaults(makeFinal = true, level = lombok.AccessLevel.PRIVATE)
@Getter
public class EnvelopeCodecConfig {
    @Builder.Default
    TimeSource timeSource = SystemTimeSource.INSTANCE;
    //envelopes above this many bytes are rejected by unwrap
    @Builder.Default
    int maxEnvelopeSize = Integer.MAX_VALUE;
}
