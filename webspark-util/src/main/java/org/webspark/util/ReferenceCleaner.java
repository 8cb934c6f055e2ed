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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Using {@link java.lang.ref.Cleaner} to perform actions when a reference is garbage collected.
 * <p>
 * The returned {@link Cleaner.Cleanable} may also be invoked explicitly, in which case the
 * action runs at most once and is not run again when the reference is collected.
 */
public final class ReferenceCleaner
{
    private static final Logger LOG = LoggerFactory.getLogger(ReferenceCleaner.class);
    private static final Cleaner CLEANER = Cleaner.create();

    private ReferenceCleaner()
    {
    }

    /**
     * @param obj the object whose reachability triggers the action
     * @param action the action, which must not hold a reference to {@code obj}
     * @return the cleanable to run the action explicitly
     */
    public static Cleaner.Cleanable register(Object obj, Runnable action)
    {
        if (LOG.isDebugEnabled())
            LOG.debug("register({}, {})", obj, action);
        return CLEANER.register(obj, new Action(action));
    }

    private static class Action implements Runnable
    {
        private final Runnable _action;

        private Action(Runnable action)
        {
            _action = action;
        }

        @Override
        public void run()
        {
            try
            {
                _action.run();
            }
            catch (RuntimeException | Error x)
            {
                LOG.warn("Failed cleaning action {}", _action, x);
                throw x;
            }
        }

        @Override
        public String toString()
        {
            return _action.toString();
        }
    }
}
