package io.proteus.events.core;

import com.google.common.base.Throwables;

public final class ThrowablesUtil
{
    private ThrowablesUtil()
    { }

    /**
     * Rethrows an unchecked throwable as is, or wraps a checked one in RuntimeException.
     * The return type lets callers write {@code throw ThrowablesUtil.propagate(ex)}.
     */
    public static RuntimeException propagate(Throwable throwable)
    {
        Throwables.throwIfUnchecked(throwable);
        throw new RuntimeException(throwable);
    }

    public static <X extends Throwable> void propagateIfInstanceOf(Throwable throwable, Class<X> declaredType)
            throws X
    {
        if (throwable != null) {
            Throwables.throwIfInstanceOf(throwable, declaredType);
        }
    }
}
