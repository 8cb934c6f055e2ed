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

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.security.Principal;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import jakarta.servlet.AsyncContext;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.ServletContext;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import jakarta.servlet.http.HttpUpgradeHandler;
import jakarta.servlet.http.Part;

/**
 * A request with a body, a content type and attributes. Everything else is unsupported.
 */
class StubHttpServletRequest implements HttpServletRequest
{
    private final Map<String, Object> _attributes = new HashMap<>();
    private final ServletInputStream _in;
    private final String _contentType;
    private final long _contentLength;

    StubHttpServletRequest(ServletInputStream in, String contentType, long contentLength)
    {
        _in = in;
        _contentType = contentType;
        _contentLength = contentLength;
    }

    @Override
    public Object getAttribute(String name)
    {
        return _attributes.get(name);
    }

    @Override
    public Enumeration<String> getAttributeNames()
    {
        return Collections.enumeration(_attributes.keySet());
    }

    @Override
    public void setAttribute(String name, Object o)
    {
        _attributes.put(name, o);
    }

    @Override
    public void removeAttribute(String name)
    {
        _attributes.remove(name);
    }

    @Override
    public ServletInputStream getInputStream()
    {
        return _in;
    }

    @Override
    public String getContentType()
    {
        return _contentType;
    }

    @Override
    public int getContentLength()
    {
        return _contentLength > Integer.MAX_VALUE ? -1 : (int)_contentLength;
    }

    @Override
    public long getContentLengthLong()
    {
        return _contentLength;
    }

    @Override
    public BufferedReader getReader()
    {
        return new BufferedReader(new InputStreamReader(_in));
    }

    @Override
    public String getCharacterEncoding()
    {
        return null;
    }

    @Override
    public void setCharacterEncoding(String env)
    {
        throw new UnsupportedOperationException();
    }

    @Override
    public String getParameter(String name)
    {
        return null;
    }

    @Override
    public Enumeration<String> getParameterNames()
    {
        return Collections.emptyEnumeration();
    }

    @Override
    public String[] getParameterValues(String name)
    {
        return null;
    }

    @Override
    public Map<String, String[]> getParameterMap()
    {
        return Collections.emptyMap();
    }

    @Override
    public String getProtocol()
    {
        return "HTTP/1.1";
    }

    @Override
    public String getScheme()
    {
        return "http";
    }

    @Override
    public String getServerName()
    {
        return "localhost";
    }

    @Override
    public int getServerPort()
    {
        return 80;
    }

    @Override
    public String getRemoteAddr()
    {
        return "127.0.0.1";
    }

    @Override
    public String getRemoteHost()
    {
        return "localhost";
    }

    @Override
    public Locale getLocale()
    {
        return Locale.getDefault();
    }

    @Override
    public Enumeration<Locale> getLocales()
    {
        return Collections.enumeration(Collections.singletonList(Locale.getDefault()));
    }

    @Override
    public boolean isSecure()
    {
        return false;
    }

    @Override
    public RequestDispatcher getRequestDispatcher(String path)
    {
        throw new UnsupportedOperationException();
    }

    @Override
    @Deprecated
    public String getRealPath(String path)
    {
        return null;
    }

    @Override
    public int getRemotePort()
    {
        return 0;
    }

    @Override
    public String getLocalName()
    {
        return "localhost";
    }

    @Override
    public String getLocalAddr()
    {
        return "127.0.0.1";
    }

    @Override
    public int getLocalPort()
    {
        return 80;
    }

    @Override
    public ServletContext getServletContext()
    {
        throw new UnsupportedOperationException();
    }

    @Override
    public AsyncContext startAsync()
    {
        throw new IllegalStateException();
    }

    @Override
    public AsyncContext startAsync(ServletRequest servletRequest, ServletResponse servletResponse)
    {
        throw new IllegalStateException();
    }

    @Override
    public boolean isAsyncStarted()
    {
        return false;
    }

    @Override
    public boolean isAsyncSupported()
    {
        return false;
    }

    @Override
    public AsyncContext getAsyncContext()
    {
        throw new IllegalStateException();
    }

    @Override
    public DispatcherType getDispatcherType()
    {
        return DispatcherType.REQUEST;
    }

    @Override
    public String getAuthType()
    {
        return null;
    }

    @Override
    public Cookie[] getCookies()
    {
        return null;
    }

    @Override
    public long getDateHeader(String name)
    {
        return -1;
    }

    @Override
    public String getHeader(String name)
    {
        if ("Content-Type".equalsIgnoreCase(name))
            return _contentType;
        return null;
    }

    @Override
    public Enumeration<String> getHeaders(String name)
    {
        String value = getHeader(name);
        return value == null ? Collections.emptyEnumeration() : Collections.enumeration(Collections.singletonList(value));
    }

    @Override
    public Enumeration<String> getHeaderNames()
    {
        return Collections.enumeration(Collections.singletonList("Content-Type"));
    }

    @Override
    public int getIntHeader(String name)
    {
        return -1;
    }

    @Override
    public String getMethod()
    {
        return "POST";
    }

    @Override
    public String getPathInfo()
    {
        return null;
    }

    @Override
    public String getPathTranslated()
    {
        return null;
    }

    @Override
    public String getContextPath()
    {
        return "";
    }

    @Override
    public String getQueryString()
    {
        return null;
    }

    @Override
    public String getRemoteUser()
    {
        return null;
    }

    @Override
    public boolean isUserInRole(String role)
    {
        return false;
    }

    @Override
    public Principal getUserPrincipal()
    {
        return null;
    }

    @Override
    public String getRequestedSessionId()
    {
        return null;
    }

    @Override
    public String getRequestURI()
    {
        return "/upload";
    }

    @Override
    public StringBuffer getRequestURL()
    {
        return new StringBuffer("http://localhost/upload");
    }

    @Override
    public String getServletPath()
    {
        return "/upload";
    }

    @Override
    public HttpSession getSession(boolean create)
    {
        if (create)
            throw new UnsupportedOperationException();
        return null;
    }

    @Override
    public HttpSession getSession()
    {
        return getSession(true);
    }

    @Override
    public String changeSessionId()
    {
        throw new IllegalStateException();
    }

    @Override
    public boolean isRequestedSessionIdValid()
    {
        return false;
    }

    @Override
    public boolean isRequestedSessionIdFromCookie()
    {
        return false;
    }

    @Override
    public boolean isRequestedSessionIdFromURL()
    {
        return false;
    }

    @Override
    @Deprecated
    public boolean isRequestedSessionIdFromUrl()
    {
        return false;
    }

    @Override
    public boolean authenticate(HttpServletResponse response)
    {
        throw new UnsupportedOperationException();
    }

    @Override
    public void login(String username, String password)
    {
        throw new UnsupportedOperationException();
    }

    @Override
    public void logout()
    {
        throw new UnsupportedOperationException();
    }

    @Override
    public Collection<Part> getParts()
    {
        throw new UnsupportedOperationException();
    }

    @Override
    public Part getPart(String name)
    {
        throw new UnsupportedOperationException();
    }

    @Override
    public <T extends HttpUpgradeHandler> T upgrade(Class<T> handlerClass)
    {
        throw new UnsupportedOperationException();
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,%d}", getClass().getSimpleName(), hashCode(), _contentType, _contentLength);
    }
}
