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

import java.io.IOException;

/**
 * The destination of the body bytes of the part being scanned.
 */
public interface PartSink
{
    /**
     * @param bytes the buffer holding the content
     * @param offset the offset of the content
     * @param length the length of the content, which may be zero
     * @throws IOException if the content cannot be stored
     */
    void write(byte[] bytes, int offset, int length) throws IOException;

    /**
     * @return the number of bytes written so far
     */
    long getSize();
}
