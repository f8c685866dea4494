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

import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds credentials in a {@link TokenRequest}.
 * <p>
 * A field is looked up in the request body, then the query, then the headers (name as given, then lower-cased).
 * If none of those carries a non-empty value, an RFC 6750 {@code Authorization: Bearer <token>} header is used,
 * whatever field was asked for. Empty values are treated as absent throughout.
 */
public class TokenResolver
{
    public static final String AUTHORIZATION_HEADER = "Authorization";

    private static final Pattern BEARER_PATTERN = Pattern.compile("Bearer (.*)");

    private final String _accessTokenField;
    private final String _refreshTokenField;

    public TokenResolver(final String accessTokenField, final String refreshTokenField)
    {
        _accessTokenField = accessTokenField;
        _refreshTokenField = refreshTokenField;
    }

    /**
     * @return the tokens carried by the request, or empty if it carries no access token
     */
    public Optional<ResolvedTokens> resolve(final TokenRequest request)
    {
        final Optional<String> accessToken = lookup(request, _accessTokenField);
        if (accessToken.isEmpty())
        {
            return Optional.empty();
        }
        // shares the Bearer fallback with the access token lookup
        final String refreshToken = lookup(request, _refreshTokenField).orElse(null);
        return Optional.of(new ResolvedTokens(accessToken.get(), refreshToken));
    }

    public Optional<String> lookup(final TokenRequest request, final String field)
    {
        if (request == null)
        {
            return Optional.empty();
        }
        return firstPresent(() -> request.getBodyField(field),
                            () -> request.getQueryField(field),
                            () -> request.getHeaderField(field),
                            () -> request.getHeaderField(field.toLowerCase(Locale.ROOT)),
                            () -> parseOAuth2Token(request));
    }

    /**
     * Extracts the token from an RFC 6750 bearer authorization header, matching the header name
     * case-insensitively.
     */
    public Optional<String> parseOAuth2Token(final TokenRequest request)
    {
        final Optional<String> headerValue =
                firstPresent(() -> request.getHeaderField(AUTHORIZATION_HEADER),
                             () -> request.getHeaderField(AUTHORIZATION_HEADER.toLowerCase(Locale.ROOT)));
        if (headerValue.isEmpty())
        {
            return Optional.empty();
        }
        final Matcher matcher = BEARER_PATTERN.matcher(headerValue.get());
        if (matcher.find())
        {
            return nonEmpty(Optional.of(matcher.group(1)));
        }
        return Optional.empty();
    }

    public String getAccessTokenField()
    {
        return _accessTokenField;
    }

    public String getRefreshTokenField()
    {
        return _refreshTokenField;
    }

    @SafeVarargs
    private static Optional<String> firstPresent(final Supplier<Optional<String>>... sources)
    {
        for (Supplier<Optional<String>> source : sources)
        {
            final Optional<String> value = nonEmpty(source.get());
            if (value.isPresent())
            {
                return value;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> nonEmpty(final Optional<String> value)
    {
        return value == null ? Optional.empty() : value.filter(v -> !v.isEmpty());
    }
}
