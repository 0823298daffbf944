package org.iceforge.repocache.api;

import org.iceforge.repocache.core.model.ViewKind;

import java.util.Arrays;
import java.util.stream.Collectors;

/** A {@code /view/bottom} request named a ranking that does not exist. */
public class UnknownViewException extends RuntimeException {
    public UnknownViewException(String kind) {
        super("Unknown view: " + kind + " (expected one of "
                + Arrays.stream(ViewKind.values()).map(ViewKind::pathSegment).collect(Collectors.joining(", ")) + ")");
    }
}
