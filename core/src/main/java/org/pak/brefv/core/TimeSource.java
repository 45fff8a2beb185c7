package org.pak.brefv.core;

import java.time.Instant;

public interface TimeSource {
    Instant now();
}
