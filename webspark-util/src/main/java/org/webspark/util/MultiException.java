//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.webspark.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Wraps multiple exceptions.
 * <p>
 * Allows the failures of several independent clean up steps to be collected
 * and thrown as a single exception once every step has been attempted.
 */
@SuppressWarnings("serial")
public class MultiException extends Exception
{
    public MultiException()
    {
        super("Multiple exceptions");
    }

    public void add(Throwable e)
    {
        if (e == null)
            throw new IllegalArgumentException();

        if (e instanceof MultiException)
        {
            MultiException me = (MultiException)e;
            me.getThrowables().forEach(this::add);
        }
        else if (getCause() == null)
        {
            initCause(e);
        }
        else
        {
            addSuppressed(e);
        }
    }

    public int size()
    {
        if (getCause() == null)
            return 0;
        return 1 + getSuppressed().length;
    }

    public boolean isEmpty()
    {
        return getCause() == null;
    }

    public List<Throwable> getThrowables()
    {
        if (getCause() == null)
            return Collections.emptyList();

        Throwable[] suppressed = getSuppressed();
        List<Throwable> list = new ArrayList<>(suppressed.length + 1);
        list.add(getCause());
        list.addAll(Arrays.asList(suppressed));
        return list;
    }

    /**
     * Throw a Runtime exception.
     * If this multi exception is empty then no action is taken. If it
     * contains a single error or runtime exception that is thrown, otherwise the this
     * multi exception is thrown, wrapped in a runtime exception.
     *
     * @throws Error If this exception contains exactly 1 {@link Error}
     * @throws RuntimeException If this exception contains 1 {@link Throwable} but it is not an error,
     * or it contains more than 1 {@link Throwable} of any type.
     */
    public void ifExceptionThrowRuntime()
        throws Error
    {
        Throwable cause = getCause();
        if (cause == null)
            return;

        if (getSuppressed().length == 0)
        {
            if (cause instanceof Error)
                throw (Error)cause;
            if (cause instanceof RuntimeException)
                throw (RuntimeException)cause;
            throw new RuntimeException(cause);
        }

        throw new RuntimeException(this);
    }

    @Override
    public String toString()
    {
        return MultiException.class.getSimpleName() + getThrowables();
    }
}
