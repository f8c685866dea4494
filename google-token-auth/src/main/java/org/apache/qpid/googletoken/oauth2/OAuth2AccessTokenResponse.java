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
package org.apache.qpid.googletoken.oauth2;

import java.util.Collections;
import java.util.Map;

public final class OAuth2AccessTokenResponse
{
    private final String _accessToken;
    private final String _refreshToken;
    private final Map<String, Object> _parameters;

    OAuth2AccessTokenResponse(final String accessToken,
                              final String refreshToken,
                              final Map<String, Object> parameters)
    {
        _accessToken = accessToken;
        _refreshToken = refreshToken;
        _parameters = Collections.unmodifiableMap(parameters);
    }

    public String getAccessToken()
    {
        return _accessToken;
    }

    /**
     * @return the refresh token, or {@code null} when the token endpoint did not issue one
     */
    public String getRefreshToken()
    {
        return _refreshToken;
    }

    /**
     * @return every field of the token endpoint response, including {@code expires_in} and {@code token_type}
     */
    public Map<String, Object> getParameters()
    {
        return _parameters;
    }
}
