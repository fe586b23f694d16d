package com.thingtalk.ast;

/**
 * The device part of a function call: which provider a function runs on.
 *
 * <p>Either a {@link DeviceSelector} naming a device class (and optionally
 * a device), or the {@link BuiltinSelector} singleton for the
 * {@code notify}, {@code return} and {@code save} pseudo-functions.
 */
public abstract sealed class Selector extends Node permits DeviceSelector, BuiltinSelector {

    protected Selector(SourceRange location) {
        super(location);
    }

    public boolean isBuiltin() {
        return false;
    }

    @Override
    public abstract Selector clone();
}
