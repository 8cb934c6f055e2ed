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

package org.webspark.http;

import jakarta.servlet.ServletRequestEvent;
import jakarta.servlet.ServletRequestListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes the {@link MultiPartFormData} parsed for a request, deleting its temporary
 * files, when the request is destroyed.
 */
public class MultiPartCleanerListener implements ServletRequestListener
{
    private static final Logger LOG = LoggerFactory.getLogger(MultiPartCleanerListener.class);

    public static final MultiPartCleanerListener INSTANCE = new MultiPartCleanerListener();

    protected MultiPartCleanerListener()
    {
    }

    @Override
    public void requestDestroyed(ServletRequestEvent sre)
    {
        Object attribute = sre.getServletRequest().getAttribute(MultiPartFormData.ATTRIBUTE);
        if (attribute instanceof MultiPartFormData)
        {
            MultiPartFormData formData = (MultiPartFormData)attribute;
            try
            {
                formData.close();
            }
            catch (Throwable e)
            {
                LOG.warn("Errors deleting multipart tmp files", e);
                sre.getServletContext().log("Errors deleting multipart tmp files", e);
            }
            finally
            {
                sre.getServletRequest().removeAttribute(MultiPartFormData.ATTRIBUTE);
            }
        }
    }

    @Override
    public void requestInitialized(ServletRequestEvent sre)
    {
        //nothing to do, the body is parsed on demand by MultiPartFormData.getFormData()
    }
}
