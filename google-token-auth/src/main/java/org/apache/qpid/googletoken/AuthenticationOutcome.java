/*
 *
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 *
 */
package org.apache.qpid.googletoken;

/**
 * Terminal result of one authentication attempt.
 * <p>
 * A host should treat {@link AuthenticationStatus#FAILURE} as an unauthenticated request and
 * {@link AuthenticationStatus#ERROR} as a server side failure.
 *
 * @param <U> application user type
 */
public final class AuthenticationOutcome<U>
{
    public enum AuthenticationStatus
    {
        SUCCESS,
        FAILURE,
        ERROR
    }

    private final AuthenticationStatus _status;
    private final U _user;
    private final Object _info;
    private final Throwable _cause;

    private AuthenticationOutcome(final AuthenticationStatus status, final U user, final Object info, final Throwable cause)
    {
        _status = status;
        _user = user;
        _info = info;
        _cause = cause;
    }

    public static <U> AuthenticationOutcome<U> success(final U user, final Object info)
    {
        if (user == null)
        {
            throw new IllegalArgumentException("A successful outcome requires a user");
        }
        return new AuthenticationOutcome<>(AuthenticationStatus.SUCCESS, user, info, null);
    }

    public static <U> AuthenticationOutcome<U> failure(final Object info)
    {
        return new AuthenticationOutcome<>(AuthenticationStatus.FAILURE, null, info, null);
    }

    public static <U> AuthenticationOutcome<U> error(final Throwable cause)
    {
        if (cause == null)
        {
            throw new IllegalArgumentException("An error outcome requires a cause");
        }
        return new AuthenticationOutcome<>(AuthenticationStatus.ERROR, null, null, cause);
    }

    public AuthenticationStatus getStatus()
    {
        return _status;
    }

    public U getUser()
    {
        return _user;
    }

    public Object getInfo()
    {
        return _info;
    }

    public Throwable getCause()
    {
        return _cause;
    }

    @Override
    public String toString()
    {
        return "AuthenticationOutcome{" +
               "status=" + _status +
               ", info=" + _info +
               ", cause=" + _cause +
               '}';
    }
}
