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

import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ReferenceCleanerTest
{
    @Test
    public void testExplicitCleanRunsOnce()
    {
        AtomicInteger runs = new AtomicInteger();
        Object owner = new Object();
        Cleaner.Cleanable cleanable = ReferenceCleaner.register(owner, runs::incrementAndGet);
        assertThat(runs.get(), is(0));
        cleanable.clean();
        cleanable.clean();
        assertThat(runs.get(), is(1));
    }

    @Test
    public void testFailingActionIsRethrown()
    {
        IllegalStateException failure = new IllegalStateException("cannot clean");
        Cleaner.Cleanable cleanable = ReferenceCleaner.register(new Object(), () ->
        {
            throw failure;
        });
        IllegalStateException x = assertThrows(IllegalStateException.class, cleanable::clean);
        assertThat(x, sameInstance(failure));
    }
}
