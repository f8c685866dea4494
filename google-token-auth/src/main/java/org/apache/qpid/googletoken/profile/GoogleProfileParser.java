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
package org.apache.qpid.googletoken.profile;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

/**
 * Maps a userinfo endpoint response onto a {@link GoogleProfile}.
 */
public class GoogleProfileParser
{
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<Map<String, Object>>()
    {
    };

    private final ObjectMapper _objectMapper;

    public GoogleProfileParser()
    {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public GoogleProfileParser(final ObjectMapper objectMapper)
    {
        _objectMapper = objectMapper;
    }

    /**
     * Claims that are not strings or numbers map to an empty string.
     *
     * @throws JsonProcessingException if {@code body} is not exactly one JSON object
     */
    public GoogleProfile parse(final String body) throws JsonProcessingException
    {
        final Map<String, Object> json = _objectMapper.readValue(body, JSON_OBJECT);
        if (json == null)
        {
            throw MismatchedInputException.from(null, Map.class, "Profile response is not a JSON object");
        }

        final ProfileName name = new ProfileName(claim(json, "family_name"),
                                                 claim(json, "given_name"),
                                                 claim(json, "middle_name"));
        return new GoogleProfile(claim(json, "sub"),
                                 claim(json, "name"),
                                 name,
                                 claim(json, "gender"),
                                 new ProfileValue(claim(json, "email")),
                                 new ProfileValue(claim(json, "picture")),
                                 body,
                                 json);
    }

    private static String claim(final Map<String, Object> json, final String claimName)
    {
        final Object value = json.get(claimName);
        if (value instanceof String)
        {
            return (String) value;
        }
        if (value instanceof Number)
        {
            return String.valueOf(value);
        }
        return "";
    }
}
