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
package org.apache.qpid.googletoken.request;

import java.util.Objects;
import java.util.Optional;

/**
 * The access token, and refresh token if any, found in a single request.
 */
public final class ResolvedTokens
{
    private final String _accessToken;
    private final String _refreshToken;

    public ResolvedTokens(final String accessToken, final String refreshToken)
    {
        if (accessToken == null || accessToken.isEmpty())
        {
            throw new IllegalArgumentException("accessToken cannot be null or empty");
        }
        _accessToken = accessToken;
        _refreshToken = refreshToken;
    }

    public String getAccessToken()
    {
        return _accessToken;
    }

    public Optional<String> getRefreshToken()
    {
        return Optional.ofNullable(_refreshToken);
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (o == null || getClass() != o.getClass())
        {
            return false;
        }
        final ResolvedTokens that = (ResolvedTokens) o;
        return _accessToken.equals(that._accessToken) && Objects.equals(_refreshToken, that._refreshToken);
    }

    @Override
    public int hashCode()
    {
        return 31 * _accessToken.hashCode() + Objects.hashCode(_refreshToken);
    }

    @Override
    public String toString()
    {
        return "ResolvedTokens{refreshTokenPresent=" + (_refreshToken != null) + '}';
    }
}
