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

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Map backed {@link TokenRequest}. Header names are normalised to lower case when the request is built, so header
 * lookups are case-insensitive.
 */
public final class SimpleTokenRequest implements TokenRequest
{
    private final Map<String, String> _body;
    private final Map<String, String> _query;
    private final Map<String, String> _headers;

    private SimpleTokenRequest(final Map<String, String> body,
                               final Map<String, String> query,
                               final Map<String, String> headers)
    {
        _body = body;
        _query = query;
        _headers = headers;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    @Override
    public Optional<String> getBodyField(final String name)
    {
        return lookup(_body, name);
    }

    @Override
    public Optional<String> getQueryField(final String name)
    {
        return lookup(_query, name);
    }

    @Override
    public Optional<String> getHeaderField(final String name)
    {
        return name == null ? Optional.empty() : lookup(_headers, name.toLowerCase(Locale.ROOT));
    }

    private static Optional<String> lookup(final Map<String, String> part, final String name)
    {
        if (part == null || name == null)
        {
            return Optional.empty();
        }
        return Optional.ofNullable(part.get(name));
    }

    @Override
    public String toString()
    {
        return "SimpleTokenRequest{" +
               "bodyFields=" + (_body == null ? null : _body.keySet()) +
               ", queryFields=" + (_query == null ? null : _query.keySet()) +
               ", headers=" + (_headers == null ? null : _headers.keySet()) +
               '}';
    }

    public static final class Builder
    {
        private Map<String, String> _body;
        private Map<String, String> _query;
        private Map<String, String> _headers;

        private Builder()
        {
        }

        public Builder body(final Map<String, String> body)
        {
            _body = body == null ? null : new HashMap<>(body);
            return this;
        }

        public Builder bodyField(final String name, final String value)
        {
            _body = put(_body, name, value);
            return this;
        }

        public Builder query(final Map<String, String> query)
        {
            _query = query == null ? null : new HashMap<>(query);
            return this;
        }

        public Builder queryField(final String name, final String value)
        {
            _query = put(_query, name, value);
            return this;
        }

        public Builder headers(final Map<String, String> headers)
        {
            _headers = null;
            if (headers != null)
            {
                _headers = new HashMap<>();
                headers.forEach(this::header);
            }
            return this;
        }

        /**
         * Adds a header. When two names differ only in case the first one added wins.
         */
        public Builder header(final String name, final String value)
        {
            if (_headers == null)
            {
                _headers = new HashMap<>();
            }
            _headers.putIfAbsent(name.toLowerCase(Locale.ROOT), value);
            return this;
        }

        public SimpleTokenRequest build()
        {
            return new SimpleTokenRequest(unmodifiable(_body), unmodifiable(_query), unmodifiable(_headers));
        }

        private static Map<String, String> put(final Map<String, String> part, final String name, final String value)
        {
            final Map<String, String> target = part == null ? new HashMap<>() : part;
            target.put(name, value);
            return target;
        }

        private static Map<String, String> unmodifiable(final Map<String, String> part)
        {
            return part == null ? null : Collections.unmodifiableMap(new HashMap<>(part));
        }
    }
}
