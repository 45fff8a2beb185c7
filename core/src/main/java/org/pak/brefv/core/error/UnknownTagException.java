package org.pak.brefv.core.error;

import lombok.Getter;

public class UnknownTagException extends CoreException {
    @Getter
    private final String tag;

    public UnknownTagException(String tag) {
        super("Tag '" + tag + "' is not well-known");
        this.tag = tag;
    }
}
